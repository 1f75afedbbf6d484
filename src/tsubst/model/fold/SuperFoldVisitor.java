package tsubst.model.fold;

import tsubst.model.region.Region;
import tsubst.model.subst.Substitution;
import tsubst.model.type.*;

import java.util.List;

/**
 * Rebuilds each compound type from children folded with the given folder. Leaves, and
 * compound types whose children all came back unchanged, are returned as the same
 * instance.
 */
public class SuperFoldVisitor extends TypeVisitor<Type, RuntimeException> {
	private final TypeFolder folder;

	public SuperFoldVisitor(TypeFolder folder) {
		this.folder = folder;
	}

	@Override
	public Type visit(AdtType adtType) throws RuntimeException {
		Substitution substitution = adtType.getSubstitution().foldWith(folder);
		if (substitution == adtType.getSubstitution()) {
			return adtType;
		}
		return new AdtType(adtType.getName(), substitution);
	}

	@Override
	public Type visit(BoolType boolType) throws RuntimeException {
		return boolType;
	}

	@Override
	public Type visit(BoxType boxType) throws RuntimeException {
		Type elementType = boxType.getElementType().foldWith(folder);
		if (elementType == boxType.getElementType()) {
			return boxType;
		}
		return new BoxType(elementType);
	}

	@Override
	public Type visit(ErrorType errorType) throws RuntimeException {
		return errorType;
	}

	@Override
	public Type visit(FunctionType functionType) throws RuntimeException {
		List<Type> paramTypes = TypeFoldables.foldAll(functionType.getParamTypes(), folder);
		Type returnType = functionType.getReturnType().foldWith(folder);
		if (paramTypes == functionType.getParamTypes() && returnType == functionType.getReturnType()) {
			return functionType;
		}
		return new FunctionType(paramTypes, returnType);
	}

	@Override
	public Type visit(IntType intType) throws RuntimeException {
		return intType;
	}

	@Override
	public Type visit(ParamType paramType) throws RuntimeException {
		return paramType;
	}

	@Override
	public Type visit(ReferenceType referenceType) throws RuntimeException {
		Region region = referenceType.getRegion().foldWith(folder);
		Type referentType = referenceType.getReferentType().foldWith(folder);
		if (region == referenceType.getRegion() && referentType == referenceType.getReferentType()) {
			return referenceType;
		}
		return new ReferenceType(region, referenceType.isMutable(), referentType);
	}

	@Override
	public Type visit(SelfType selfType) throws RuntimeException {
		return selfType;
	}

	@Override
	public Type visit(SliceType sliceType) throws RuntimeException {
		Type elementType = sliceType.getElementType().foldWith(folder);
		if (elementType == sliceType.getElementType()) {
			return sliceType;
		}
		return new SliceType(elementType);
	}

	@Override
	public Type visit(StringType stringType) throws RuntimeException {
		return stringType;
	}

	@Override
	public Type visit(TraitObjectType traitObjectType) throws RuntimeException {
		TraitRef traitRef = traitObjectType.getTraitRef().foldWith(folder);
		Region bound = traitObjectType.getBound().foldWith(folder);
		if (traitRef == traitObjectType.getTraitRef() && bound == traitObjectType.getBound()) {
			return traitObjectType;
		}
		return new TraitObjectType(traitRef, bound);
	}

	@Override
	public Type visit(TupleType tupleType) throws RuntimeException {
		List<Type> elementTypes = TypeFoldables.foldAll(tupleType.getElementTypes(), folder);
		if (elementTypes == tupleType.getElementTypes()) {
			return tupleType;
		}
		return new TupleType(elementTypes);
	}
}
