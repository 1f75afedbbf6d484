package tsubst.model.type;

import tsubst.model.fold.TypeFoldables;
import tsubst.model.fold.TypeFolder;
import tsubst.model.subst.Substitutable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The declared signature of a function item.
 */
public class FunctionSignature implements Substitutable<FunctionSignature> {
	private final List<Type> inputs;
	private final Type output;
	private final boolean variadic;

	public FunctionSignature(List<Type> inputs, Type output, boolean variadic) {
		this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
		this.output = output;
		this.variadic = variadic;
	}

	public List<Type> getInputs() {
		return inputs;
	}

	public Type getOutput() {
		return output;
	}

	public boolean isVariadic() {
		return variadic;
	}

	public FunctionType toFunctionType() {
		return new FunctionType(inputs, output);
	}

	@Override
	public FunctionSignature foldWith(TypeFolder folder) {
		List<Type> foldedInputs = TypeFoldables.foldAll(inputs, folder);
		Type foldedOutput = output.foldWith(folder);
		if (foldedInputs == inputs && foldedOutput == output) {
			return this;
		}
		return new FunctionSignature(foldedInputs, foldedOutput, variadic);
	}

	@Override
	public int hashCode() {
		return inputs.hashCode() * 17 + output.hashCode() * 19 + (variadic ? 1 : 0);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof FunctionSignature)) {
			return false;
		}
		FunctionSignature other = (FunctionSignature) obj;
		return variadic == other.variadic && inputs.equals(other.inputs) && output.equals(other.output);
	}

	@Override
	public String toString() {
		return toFunctionType().toString() + (variadic ? " ..." : "");
	}
}
