package tsubst.model.fold;

import org.junit.Before;
import org.junit.Test;
import tsubst.errors.Issue;
import tsubst.errors.IssueWithContext;
import tsubst.errors.TopLevelIssueContext;
import tsubst.model.region.Region;
import tsubst.model.region.StaticRegion;
import tsubst.model.subst.MissingSelfTypeIssue;
import tsubst.model.subst.RegionSubstitution;
import tsubst.model.subst.Substitution;
import tsubst.model.type.*;
import tsubst.util.SourceLocation;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class TypeFoldablesTest {
	private TopLevelIssueContext issues;
	private TypeContext ctx;

	// replaces every int with bool and every region with 'static
	private class IntToBoolFolder extends TypeFolder {
		int visited = 0;

		@Override
		public TypeContext getContext() {
			return ctx;
		}

		@Override
		public Type foldType(Type type) {
			visited++;
			if (type instanceof IntType) {
				return ctx.mkBool();
			}
			return superFoldType(type);
		}

		@Override
		public Region foldRegion(Region region) {
			return StaticRegion.getInstance();
		}
	}

	@Before
	public void setup() {
		issues = new TopLevelIssueContext();
		ctx = new TypeContext(issues);
	}

	@Test
	public void foldAllKeepsListWhenNothingChanges() {
		List<Type> types = Arrays.asList(ctx.mkBool(), ctx.mkString(), new SliceType(ctx.mkBool()));
		assertSame(types, TypeFoldables.foldAll(types, new IntToBoolFolder()));
	}

	@Test
	public void foldAllRebuildsChangedList() {
		List<Type> types = Arrays.asList(ctx.mkString(), ctx.mkInt(), ctx.mkString());
		List<Type> folded = TypeFoldables.foldAll(types, new IntToBoolFolder());
		assertEquals(Arrays.asList(ctx.mkString(), ctx.mkBool(), ctx.mkString()), folded);
		assertSame(types.get(0), folded.get(0));
	}

	@Test
	public void superFoldReachesEveryChild() {
		Type type = new FunctionType(
				Arrays.asList(
						new TupleType(Arrays.asList(ctx.mkInt(), new BoxType(ctx.mkInt()))),
						new ReferenceType(ctx.staticRegion(), true, new SliceType(ctx.mkInt()))),
				new AdtType("Vec", new Substitution(
						null, Collections.singletonList(ctx.mkInt()), RegionSubstitution.erased())));
		Type expected = new FunctionType(
				Arrays.asList(
						new TupleType(Arrays.asList(ctx.mkBool(), new BoxType(ctx.mkBool()))),
						new ReferenceType(ctx.staticRegion(), true, new SliceType(ctx.mkBool()))),
				new AdtType("Vec", new Substitution(
						null, Collections.singletonList(ctx.mkBool()), RegionSubstitution.erased())));
		assertEquals(expected, type.foldWith(new IntToBoolFolder()));
	}

	@Test
	public void substAllUsesOneTable() {
		List<Type> types = Arrays.asList(ctx.mkParam(0, "T"), new SliceType(ctx.mkParam(1, "U")), ctx.mkInt());
		Substitution substitution = new Substitution(
				null, Arrays.asList(ctx.mkString(), ctx.mkBool()), RegionSubstitution.erased());
		assertEquals(
				Arrays.asList(ctx.mkString(), new SliceType(ctx.mkBool()), ctx.mkInt()),
				TypeFoldables.substAll(types, ctx, substitution));
		assertFalse(issues.hasErrors());
	}

	@Test
	public void substAllAtReportsEachIssueAtLocation() {
		SourceLocation location = new SourceLocation(Paths.get("x.rs"), 0, 0, 0, 3);
		List<Type> types = Arrays.asList(ctx.mkParam(5, "T5"), ctx.mkSelf(), new BoxType(ctx.mkParam(3, "T3")));
		Substitution substitution = new Substitution(
				null, Arrays.asList(ctx.mkString(), ctx.mkBool()), RegionSubstitution.erased());
		assertEquals(
				Arrays.asList(ctx.mkError(), ctx.mkError(), new BoxType(ctx.mkError())),
				TypeFoldables.substAllAt(types, ctx, substitution, location));
		assertEquals(3, issues.getIssues().size());
		for (Issue issue : issues.getIssues()) {
			assertTrue(issue instanceof IssueWithContext);
			assertEquals(location, ((AtSourceLocation) ((IssueWithContext) issue).getContext()).getLocation());
			assertTrue(issue.getMessage().startsWith("at 1:1-3 in file x.rs"));
		}
		assertTrue(((IssueWithContext) issues.getIssues().get(1)).getIssue() instanceof MissingSelfTypeIssue);
		assertTrue(issues.getIssues().get(2).getMessage().contains("in the substitution of `Box<T3>`"));
	}
}
