package tsubst.model.subst;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import tsubst.errors.TopLevelIssueContext;
import tsubst.model.type.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;

@RunWith(Parameterized.class)
public class TypeParamIndexTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ 0, new IntType(), 0 },
				{ 1, new BoolType(), 0 },
				{ 2, new StringType(), 0 },
				{ 3, new ErrorType(), 1 },
				{ 17, new ErrorType(), 1 },
		});
	}

	private final int index;
	private final Type expected;
	private final int expectedIssues;

	public TypeParamIndexTest(int index, Type expected, int expectedIssues) {
		this.index = index;
		this.expected = expected;
		this.expectedIssues = expectedIssues;
	}

	@Test
	public void test() {
		TopLevelIssueContext issues = new TopLevelIssueContext();
		TypeContext ctx = new TypeContext(issues);
		Substitution substitution = new Substitution(
				null, Arrays.asList(ctx.mkInt(), ctx.mkBool(), ctx.mkString()),
				RegionSubstitution.nonErased(Collections.emptyList()));
		assertEquals(expected, ctx.mkParam(index, "P" + index).subst(ctx, substitution));
		assertEquals(expectedIssues, issues.getIssues().size());
	}
}
