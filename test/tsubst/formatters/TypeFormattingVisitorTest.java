package tsubst.formatters;

import org.junit.Test;
import tsubst.model.region.EarlyBoundRegion;
import tsubst.model.region.FreeRegion;
import tsubst.model.region.StaticRegion;
import tsubst.model.subst.RegionSubstitution;
import tsubst.model.subst.Substitution;
import tsubst.model.type.*;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;

public class TypeFormattingVisitorTest {

	@Test
	public void functionType() {
		Type fn = new FunctionType(
				Arrays.asList(new ParamType(0, "T"), new SelfType()),
				new TupleType(Collections.emptyList()));
		assertEquals("fn(T, Self) -> ()", fn.toString());
	}

	@Test
	public void references() {
		assertEquals("&'a mut [int]",
				new ReferenceType(new EarlyBoundRegion(0, "a"), true, new SliceType(new IntType())).toString());
		assertEquals("&'static Box<bool>",
				new ReferenceType(StaticRegion.getInstance(), false, new BoxType(new BoolType())).toString());
		assertEquals("&'f#3 string",
				new ReferenceType(new FreeRegion(3, "f"), false, new StringType()).toString());
	}

	@Test
	public void genericApplications() {
		Substitution args = new Substitution(
				null, Arrays.asList(new IntType(), new ParamType(0, "T")),
				RegionSubstitution.nonErased(Collections.singletonList(new EarlyBoundRegion(0, "a"))));
		assertEquals("HashMap<'a, int, T>", new AdtType("HashMap", args).toString());
		assertEquals("Unit", new AdtType("Unit", Substitution.erasedEmpty()).toString());
	}

	@Test
	public void traitRefs() {
		TraitRef iterator = new TraitRef("Iterator", new Substitution(
				new ParamType(0, "I"), Collections.singletonList(new StringType()), RegionSubstitution.erased()));
		assertEquals("<I as Iterator<string>>", iterator.toString());
		TraitRef display = new TraitRef("Display", Substitution.empty());
		assertEquals("dyn Display + 'static", new TraitObjectType(display, StaticRegion.getInstance()).toString());
	}

	@Test
	public void errorType() {
		assertEquals("([type error], int)",
				new TupleType(Arrays.asList(new ErrorType(), new IntType())).toString());
	}
}
