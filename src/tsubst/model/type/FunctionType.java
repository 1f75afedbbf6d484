package tsubst.model.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the function type.
 */
public class FunctionType extends Type {
	private final List<Type> paramTypes;
	private final Type returnType;

	public FunctionType(List<Type> paramTypes, Type returnType) {
		super(anyNeedsSubstitution(paramTypes) || returnType.needsSubstitution());
		this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
		this.returnType = returnType;
	}

	public List<Type> getParamTypes() {
		return paramTypes;
	}

	public Type getReturnType() {
		return returnType;
	}

	@Override
	public int hashCode() {
		return paramTypes.hashCode() * 17 + returnType.hashCode() * 19 + 2;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FunctionType)) {
			return false;
		}
		FunctionType fun = (FunctionType) obj;
		return paramTypes.equals(fun.paramTypes) && returnType.equals(fun.returnType);
	}

	@Override
	public <T, E extends Throwable> T accept(TypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
