package tsubst.model.type;

import tsubst.SubstOptions;
import tsubst.errors.Issue;
import tsubst.errors.IssueContext;
import tsubst.model.region.Region;
import tsubst.model.region.StaticRegion;
import tsubst.util.SourceLocation;

import java.util.HashMap;
import java.util.Map;

/**
 * Shared state for one compilation: canonical type instances, the options in effect and
 * the sink that receives reported issues.
 */
public class TypeContext {
	private final IssueContext issueContext;
	private final SubstOptions options;

	private final BoolType boolType = new BoolType();
	private final IntType intType = new IntType();
	private final StringType stringType = new StringType();
	private final ErrorType errorType = new ErrorType();
	private final SelfType selfType = new SelfType();
	private final Map<ParamType, ParamType> paramTypes = new HashMap<>();

	public TypeContext(IssueContext issueContext) {
		this(issueContext, SubstOptions.defaults());
	}

	public TypeContext(IssueContext issueContext, SubstOptions options) {
		this.issueContext = issueContext;
		this.options = options;
	}

	public SubstOptions getOptions() {
		return options;
	}

	public void error(Issue issue) {
		issueContext.error(issue);
	}

	public void spanError(SourceLocation location, Issue issue) {
		issueContext.withContext(new AtSourceLocation(location)).error(issue);
	}

	public BoolType mkBool() {
		return boolType;
	}

	public IntType mkInt() {
		return intType;
	}

	public StringType mkString() {
		return stringType;
	}

	public ErrorType mkError() {
		return errorType;
	}

	public SelfType mkSelf() {
		return selfType;
	}

	public ParamType mkParam(int index, String name) {
		return paramTypes.computeIfAbsent(new ParamType(index, name), p -> p);
	}

	public Region staticRegion() {
		return StaticRegion.getInstance();
	}
}
