package org.javai.querybuilder.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.javai.querybuilder.model.CaseWhenBranch;
import org.javai.querybuilder.model.CaseWhenSpec;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.GroupBySpec;
import org.javai.querybuilder.model.JoinKind;
import org.javai.querybuilder.model.JoinSpec;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.LogicOperator;
import org.javai.querybuilder.model.SortDirection;
import org.javai.querybuilder.model.SortSpec;
import org.javai.querybuilder.model.TableReference;
import org.javai.querybuilder.model.WindowFunctionSpec;
import org.javai.querybuilder.narrative.QueryNarrator;
import org.javai.querybuilder.narrative.RequirementsTranscriber;
import org.javai.querybuilder.validation.QueryValidator;
import org.javai.querybuilder.validation.ValidationResult;

/**
 * The aggregate holding a SELECT query's configuration.
 *
 * <p>An assembly starts empty and is populated only through its mutation
 * operations, in any order. Every operation accepts its input unconditionally and
 * returns the value it created; malformed configuration surfaces in the rendered
 * SQL, in {@link QueryValidator} diagnostics or in {@link QueryConsistencyChecker}
 * findings, never as an exception here. There is no removal; to drop an element,
 * rebuild a fresh assembly from a filtered configuration document.</p>
 *
 * <h2>Positional invariants</h2>
 * <ul>
 *   <li>The first table is the driving table of the FROM clause. Tables added by
 *       {@link #addJoin} are appended after it, so insertion order decides which
 *       table drives the query.</li>
 *   <li>Each filter's {@link LogicOperator} links it to the filter before it. The
 *       first filter's operator has no predecessor and is not rendered.</li>
 * </ul>
 *
 * <p>Instances are not thread-safe; use one assembly per editing session.</p>
 *
 * <pre>{@code
 * QueryAssembly query = new QueryAssembly();
 * query.addTable("products", "p", List.of("product_id", "price"));
 * query.addJoin("p", "categories", "c", "category_id", "category_id",
 *         JoinKind.LEFT, List.of("category_name"));
 * query.addFilter("p", "price", FilterOperator.GREATER, 100, LogicOperator.AND);
 * String sql = query.toSql();
 * }</pre>
 */
public class QueryAssembly {

	private final List<TableReference> tables = new ArrayList<>();
	private final List<JoinSpec> joins = new ArrayList<>();
	private final List<FilterCondition> filters = new ArrayList<>();
	private final List<CaseWhenSpec> caseWhens = new ArrayList<>();
	private final List<WindowFunctionSpec> windowFunctions = new ArrayList<>();
	private final List<SortSpec> orderBys = new ArrayList<>();
	private GroupBySpec groupBy;
	private boolean distinct;
	private Integer limit;
	private Integer offset;

	public TableReference addTable(String name, String alias, List<String> fields) {
		TableReference table = new TableReference(name, alias, fields);
		tables.add(table);
		return table;
	}

	public TableReference addTable(String name, String alias) {
		return addTable(name, alias, List.of());
	}

	/**
	 * Adds a join and appends its right-hand table to the table list.
	 */
	public JoinSpec addJoin(String leftAlias, String rightTableName, String rightAlias,
			String leftField, String rightField, JoinKind kind, List<String> rightFields) {
		TableReference rightTable = new TableReference(rightTableName, rightAlias, rightFields);
		tables.add(rightTable);
		JoinSpec join = new JoinSpec(leftAlias, rightTable, kind != null ? kind : JoinKind.LEFT,
				leftField, rightField);
		joins.add(join);
		return join;
	}

	public JoinSpec addJoin(String leftAlias, String rightTableName, String rightAlias,
			String leftField, String rightField) {
		return addJoin(leftAlias, rightTableName, rightAlias, leftField, rightField, JoinKind.LEFT, List.of());
	}

	/**
	 * Adds a WHERE condition. The value is not checked against the operator's
	 * arity; the renderer uses or ignores it per operator.
	 *
	 * @param value a {@link Literal} or a plain Java value converted with {@link Literal#of}
	 */
	public FilterCondition addFilter(String tableAlias, String field, FilterOperator operator,
			Object value, LogicOperator logic) {
		FilterCondition filter = new FilterCondition(tableAlias, field, operator, Literal.of(value), logic);
		filters.add(filter);
		return filter;
	}

	public FilterCondition addFilter(String tableAlias, String field, FilterOperator operator, Object value) {
		return addFilter(tableAlias, field, operator, value, LogicOperator.AND);
	}

	/**
	 * Adds a CASE WHEN computed column.
	 *
	 * @param elseValue the ELSE result; {@code null} omits the ELSE branch
	 */
	public CaseWhenSpec addCaseWhen(String alias, List<CaseWhenBranch> branches, Object elseValue) {
		CaseWhenSpec caseWhen = new CaseWhenSpec(alias, branches, elseValue == null ? null : Literal.of(elseValue));
		caseWhens.add(caseWhen);
		return caseWhen;
	}

	public WindowFunctionSpec addWindowFunction(String functionName, String tableAlias, String field,
			List<String> partitionBy, List<SortSpec> orderBy, String alias) {
		WindowFunctionSpec window = new WindowFunctionSpec(functionName, tableAlias, field, partitionBy, orderBy, alias);
		windowFunctions.add(window);
		return window;
	}

	/**
	 * Sets the grouping, replacing any previous one.
	 */
	public GroupBySpec setGroupBy(List<String> fields, List<FilterCondition> having) {
		this.groupBy = new GroupBySpec(fields, having);
		return groupBy;
	}

	public SortSpec addOrderBy(String tableAlias, String field, SortDirection direction) {
		SortSpec sort = new SortSpec(tableAlias, field, direction);
		orderBys.add(sort);
		return sort;
	}

	public SortSpec addOrderBy(String tableAlias, String field) {
		return addOrderBy(tableAlias, field, SortDirection.ASC);
	}

	/**
	 * Sets pagination. A {@code null} or zero limit renders no LIMIT clause; the
	 * offset is rendered only alongside a limit and only when positive.
	 */
	public void setLimit(Integer limit, Integer offset) {
		this.limit = limit;
		this.offset = offset;
	}

	public void setLimit(Integer limit) {
		setLimit(limit, null);
	}

	public void setDistinct(boolean distinct) {
		this.distinct = distinct;
	}

	/**
	 * @return the rendered SELECT statement; recomputed on every call
	 */
	public String toSql() {
		return SqlRenderer.render(this);
	}

	/**
	 * Validates this assembly's own rendered SQL with default settings.
	 */
	public ValidationResult validate() {
		return new QueryValidator().validate(toSql());
	}

	public String describe() {
		return QueryNarrator.describe(this);
	}

	public String requirements() {
		return RequirementsTranscriber.transcribe(this);
	}

	public List<TableReference> tables() {
		return Collections.unmodifiableList(tables);
	}

	public List<JoinSpec> joins() {
		return Collections.unmodifiableList(joins);
	}

	public List<FilterCondition> filters() {
		return Collections.unmodifiableList(filters);
	}

	public List<CaseWhenSpec> caseWhens() {
		return Collections.unmodifiableList(caseWhens);
	}

	public List<WindowFunctionSpec> windowFunctions() {
		return Collections.unmodifiableList(windowFunctions);
	}

	public List<SortSpec> orderBys() {
		return Collections.unmodifiableList(orderBys);
	}

	public Optional<GroupBySpec> groupBy() {
		return Optional.ofNullable(groupBy);
	}

	public boolean isDistinct() {
		return distinct;
	}

	/**
	 * @return the limit, or {@code null} when unset
	 */
	public Integer limit() {
		return limit;
	}

	/**
	 * @return the offset, or {@code null} when unset
	 */
	public Integer offset() {
		return offset;
	}
}
