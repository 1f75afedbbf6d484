package tsubst.model.type;

import org.junit.Before;
import org.junit.Test;
import tsubst.errors.IssueWithContext;
import tsubst.errors.TopLevelIssueContext;
import tsubst.model.region.EarlyBoundRegion;
import tsubst.model.region.StaticRegion;
import tsubst.model.subst.MissingSelfTypeIssue;
import tsubst.model.subst.RegionSubstitution;
import tsubst.model.subst.Substitution;
import tsubst.util.SourceLocation;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class TypeContextTest {
	private TopLevelIssueContext issues;
	private TypeContext ctx;

	@Before
	public void setup() {
		issues = new TopLevelIssueContext();
		ctx = new TypeContext(issues);
	}

	@Test
	public void paramsAreInterned() {
		assertSame(ctx.mkParam(0, "T"), ctx.mkParam(0, "T"));
		assertNotSame(ctx.mkParam(0, "T"), ctx.mkParam(1, "T"));
	}

	@Test
	public void canonicalInstances() {
		assertSame(ctx.mkInt(), ctx.mkInt());
		assertSame(StaticRegion.getInstance(), ctx.staticRegion());
		assertEquals(new ErrorType(), ctx.mkError());
	}

	@Test
	public void needsSubstitutionIsComputedFromChildren() {
		assertFalse(ctx.mkInt().needsSubstitution());
		assertTrue(ctx.mkSelf().needsSubstitution());
		assertTrue(new TupleType(Arrays.asList(ctx.mkInt(), ctx.mkParam(0, "T"))).needsSubstitution());
		assertFalse(new TupleType(Arrays.asList(ctx.mkInt(), ctx.mkBool())).needsSubstitution());
		assertTrue(new ReferenceType(new EarlyBoundRegion(0, "a"), false, ctx.mkInt()).needsSubstitution());
		assertTrue(new AdtType("Rc", new Substitution(
				ctx.mkSelf(), Collections.emptyList(), RegionSubstitution.erased())).needsSubstitution());
		assertFalse(new FunctionType(Collections.emptyList(), ctx.mkInt()).needsSubstitution());
	}

	@Test
	public void errorsWithoutLocation() {
		ctx.error(new MissingSelfTypeIssue(null));
		assertEquals(1, issues.getIssues().size());
		assertEquals("missing `Self` type param", issues.getIssues().get(0).getMessage());
	}

	@Test
	public void errorsWithLocation() {
		SourceLocation location = new SourceLocation(Paths.get("main.rs"), 0, 0, 2, 2);
		ctx.spanError(location, new MissingSelfTypeIssue(null));
		assertEquals(1, issues.getIssues().size());
		assertTrue(issues.getIssues().get(0) instanceof IssueWithContext);
		assertEquals(
				"at 1:3 in file main.rs" + System.lineSeparator() + "    missing `Self` type param",
				issues.getIssues().get(0).getMessage());
	}

	@Test
	public void signatureAsFunctionType() {
		FunctionSignature sig = new FunctionSignature(Collections.singletonList(ctx.mkInt()), ctx.mkBool(), false);
		assertEquals(new FunctionType(Collections.singletonList(ctx.mkInt()), ctx.mkBool()), sig.toFunctionType());
	}
}
