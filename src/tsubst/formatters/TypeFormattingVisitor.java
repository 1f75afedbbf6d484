package tsubst.formatters;

import tsubst.model.region.Region;
import tsubst.model.subst.NonErasedRegions;
import tsubst.model.subst.Substitution;
import tsubst.model.type.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class TypeFormattingVisitor extends TypeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public TypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeRegion(Region region) throws IOException {
		region.accept(new RegionFormattingVisitor(out));
	}

	private void writeGenericArgs(Substitution substitution) throws IOException {
		List<Object> args = new ArrayList<>();
		if (substitution.getRegions() instanceof NonErasedRegions) {
			args.addAll(((NonErasedRegions) substitution.getRegions()).getRegions());
		}
		args.addAll(substitution.getTypeParams());
		if (args.isEmpty()) {
			return;
		}
		out.write("<");
		FormattingTools.writeCommaSeparated(out, args, a -> {
			if (a instanceof Region) {
				writeRegion((Region) a);
			} else {
				((Type) a).accept(this);
			}
		});
		out.write(">");
	}

	public void writeTraitRef(TraitRef traitRef) throws IOException {
		Substitution substitution = traitRef.getSubstitution();
		if (substitution.hasSelfType()) {
			out.write("<");
			substitution.getSelfType().accept(this);
			out.write(" as ");
		}
		out.write(traitRef.getTraitName());
		writeGenericArgs(substitution);
		if (substitution.hasSelfType()) {
			out.write(">");
		}
	}

	@Override
	public Void visit(AdtType adtType) throws IOException {
		out.write(adtType.getName());
		writeGenericArgs(adtType.getSubstitution());
		return null;
	}

	@Override
	public Void visit(BoolType boolType) throws IOException {
		out.write("bool");
		return null;
	}

	@Override
	public Void visit(BoxType boxType) throws IOException {
		out.write("Box<");
		boxType.getElementType().accept(this);
		out.write(">");
		return null;
	}

	@Override
	public Void visit(ErrorType errorType) throws IOException {
		out.write("[type error]");
		return null;
	}

	@Override
	public Void visit(FunctionType functionType) throws IOException {
		out.write("fn(");
		FormattingTools.writeCommaSeparated(out, functionType.getParamTypes(), p -> p.accept(this));
		out.write(") -> ");
		functionType.getReturnType().accept(this);
		return null;
	}

	@Override
	public Void visit(IntType intType) throws IOException {
		out.write("int");
		return null;
	}

	@Override
	public Void visit(ParamType paramType) throws IOException {
		out.write(paramType.getName());
		return null;
	}

	@Override
	public Void visit(ReferenceType referenceType) throws IOException {
		out.write("&");
		writeRegion(referenceType.getRegion());
		out.write(" ");
		if (referenceType.isMutable()) {
			out.write("mut ");
		}
		referenceType.getReferentType().accept(this);
		return null;
	}

	@Override
	public Void visit(SelfType selfType) throws IOException {
		out.write("Self");
		return null;
	}

	@Override
	public Void visit(SliceType sliceType) throws IOException {
		out.write("[");
		sliceType.getElementType().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(StringType stringType) throws IOException {
		out.write("string");
		return null;
	}

	@Override
	public Void visit(TraitObjectType traitObjectType) throws IOException {
		out.write("dyn ");
		writeTraitRef(traitObjectType.getTraitRef());
		out.write(" + ");
		writeRegion(traitObjectType.getBound());
		return null;
	}

	@Override
	public Void visit(TupleType tupleType) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tupleType.getElementTypes(), t -> t.accept(this));
		out.write(")");
		return null;
	}
}
