package tsubst.model.subst;

import tsubst.InternalCompilerError;
import tsubst.errors.Issue;
import tsubst.model.fold.TypeFolder;
import tsubst.model.region.EarlyBoundRegion;
import tsubst.model.region.Region;
import tsubst.model.type.ParamType;
import tsubst.model.type.SelfType;
import tsubst.model.type.Type;
import tsubst.model.type.TypeContext;
import tsubst.util.SourceLocation;

import java.util.List;
import java.util.logging.Logger;

/**
 * The substitution engine itself. Replaces type parameters, the self type and early-bound
 * regions according to a {@link Substitution}, and rebuilds everything else around them.
 *
 * A folder is created for one substitution call and must not be shared.
 */
public class SubstitutionFolder extends TypeFolder {
	private static final Logger logger = Logger.getLogger(SubstitutionFolder.class.getName());

	private final TypeContext ctx;
	private final Substitution substitution;

	// where the substitution was requested, if known
	private final SourceLocation location;

	// the outermost type being substituted, if any
	private Type root;

	private int depth;

	public SubstitutionFolder(TypeContext ctx, Substitution substitution, SourceLocation location) {
		this.ctx = ctx;
		this.substitution = substitution;
		this.location = location;
		this.root = null;
		this.depth = 0;
	}

	@Override
	public TypeContext getContext() {
		return ctx;
	}

	public int getDepth() {
		return depth;
	}

	/**
	 * Only handles regions bound on type declarations and other outer declarations. Regions
	 * bound in function signatures are late-bound and pass through untouched.
	 */
	@Override
	public Region foldRegion(Region region) {
		if (!(region instanceof EarlyBoundRegion)) {
			return region;
		}
		EarlyBoundRegion earlyBound = (EarlyBoundRegion) region;
		return substitution.getRegions().accept(new RegionSubstitutionVisitor<Region, RuntimeException>() {
			@Override
			public Region visit(ErasedRegions erasedRegions) {
				return ctx.staticRegion();
			}

			@Override
			public Region visit(NonErasedRegions nonErasedRegions) {
				List<Region> regions = nonErasedRegions.getRegions();
				if (earlyBound.getIndex() >= regions.size()) {
					throw new InternalCompilerError(
							"region parameter " + earlyBound + " has index " + earlyBound.getIndex() +
									" but only " + regions.size() + " region(s) are being substituted");
				}
				return regions.get(earlyBound.getIndex());
			}
		});
	}

	@Override
	public Type foldType(Type type) {
		if (!type.needsSubstitution()) {
			return type;
		}

		int entryDepth = depth;
		if (entryDepth == 0) {
			root = type;
			if (ctx.getOptions().isTraceEnabled()) {
				logger.finer(() -> "substituting " + type + " with " + substitution);
			}
		}
		depth++;

		Type result;
		if (type instanceof ParamType) {
			result = substituteParam((ParamType) type);
		} else if (type instanceof SelfType) {
			result = substituteSelf();
		} else {
			result = superFoldType(type);
		}

		if (depth != entryDepth + 1) {
			throw new InternalCompilerError(
					"substitution depth is " + depth + " on exit, expected " + (entryDepth + 1));
		}
		depth--;
		if (entryDepth == 0) {
			root = null;
		}

		return result;
	}

	private Type substituteParam(ParamType param) {
		List<Type> typeParams = substitution.getTypeParams();
		if (param.getIndex() < typeParams.size()) {
			return typeParams.get(param.getIndex());
		}
		return report(new OuterTypeParameterIssue(param, root));
	}

	private Type substituteSelf() {
		if (substitution.hasSelfType()) {
			return substitution.getSelfType();
		}
		return report(new MissingSelfTypeIssue(root));
	}

	private Type report(Issue issue) {
		logger.fine(() -> "reporting " + issue.getMessage());
		if (location != null) {
			ctx.spanError(location, issue);
		} else {
			ctx.error(issue);
		}
		return ctx.mkError();
	}
}
