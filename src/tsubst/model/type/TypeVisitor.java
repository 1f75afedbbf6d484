package tsubst.model.type;

public abstract class TypeVisitor<T, E extends Throwable> {
	public abstract T visit(AdtType adtType) throws E;
	public abstract T visit(BoolType boolType) throws E;
	public abstract T visit(BoxType boxType) throws E;
	public abstract T visit(ErrorType errorType) throws E;
	public abstract T visit(FunctionType functionType) throws E;
	public abstract T visit(IntType intType) throws E;
	public abstract T visit(ParamType paramType) throws E;
	public abstract T visit(ReferenceType referenceType) throws E;
	public abstract T visit(SelfType selfType) throws E;
	public abstract T visit(SliceType sliceType) throws E;
	public abstract T visit(StringType stringType) throws E;
	public abstract T visit(TraitObjectType traitObjectType) throws E;
	public abstract T visit(TupleType tupleType) throws E;
}
