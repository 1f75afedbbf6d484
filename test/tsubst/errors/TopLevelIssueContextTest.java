package tsubst.errors;

import org.junit.Test;
import tsubst.model.subst.MissingSelfTypeIssue;
import tsubst.model.subst.OuterTypeParameterIssue;
import tsubst.model.type.AtSourceLocation;
import tsubst.model.type.ParamType;
import tsubst.model.type.SliceType;
import tsubst.util.SourceLocation;

import static org.junit.Assert.*;

public class TopLevelIssueContextTest {

	@Test
	public void formatsAllIssuesInOrder() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		ParamType param = new ParamType(4, "U");
		ctx.error(new OuterTypeParameterIssue(param, new SliceType(param)));
		ctx.error(new MissingSelfTypeIssue(null));
		assertTrue(ctx.hasErrors());
		String lf = System.lineSeparator();
		assertEquals(
				"Detected 2 issue(s):" + lf +
						"can't use type parameters from outer function in the substitution of `[U]`; " +
						"try using a local type parameter instead" + lf +
						"missing `Self` type param",
				ctx.format());
	}

	@Test
	public void nestedContextReachesParent() {
		TopLevelIssueContext top = new TopLevelIssueContext();
		IssueContext nested = top.withContext(new AtSourceLocation(SourceLocation.unknown()));
		assertFalse(nested.hasErrors());
		nested.error(new MissingSelfTypeIssue(null));
		assertTrue(nested.hasErrors());
		assertEquals(
				"at unknown source location" + System.lineSeparator() + "    missing `Self` type param",
				top.getIssues().get(0).getMessage());
	}
}
