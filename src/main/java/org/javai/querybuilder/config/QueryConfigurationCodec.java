package org.javai.querybuilder.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.javai.querybuilder.assembly.QueryAssembly;
import org.javai.querybuilder.model.CaseWhenBranch;
import org.javai.querybuilder.model.CaseWhenSpec;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.JoinKind;
import org.javai.querybuilder.model.JoinSpec;
import org.javai.querybuilder.model.Literal;
import org.javai.querybuilder.model.LogicOperator;
import org.javai.querybuilder.model.SortDirection;
import org.javai.querybuilder.model.SortSpec;
import org.javai.querybuilder.model.TableReference;
import org.javai.querybuilder.model.WindowFunctionSpec;

/**
 * Converts between a {@link QueryAssembly} and its JSON configuration document.
 *
 * <p>The document holds the directly added tables under {@code tables}; tables
 * brought in by a join travel with their join under {@code joins}. A direct table
 * added after one or more joins carries {@code afterJoin}, the number of joins
 * that preceded it, so rebuilding interleaves tables and joins in their original
 * order. The remaining sections are applied in a fixed order: filters, group-by,
 * window functions, case-whens, order-bys, distinct, limit. A rebuilt assembly
 * renders the same SQL as its source.</p>
 *
 * <h2>Literal encoding</h2>
 * <ul>
 *   <li>text, numbers and booleans map to the matching JSON scalar; decimals
 *       keep their scale</li>
 *   <li>sequences map to arrays</li>
 *   <li>{@code NULL} maps to JSON {@code null}</li>
 *   <li>verbatim values map to {@code {"raw": "..."}}</li>
 * </ul>
 *
 * <p>A missing key means empty, false or absent. A {@code limit} or
 * {@code offset} of 0 means absent. Unknown enum names raise
 * {@link ConfigurationException}.</p>
 */
public class QueryConfigurationCodec {

	private static final String RAW = "raw";
	private static final String AFTER_JOIN = "afterJoin";

	private final ObjectMapper mapper;

	public QueryConfigurationCodec() {
		this(documentMapper());
	}

	public QueryConfigurationCodec(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	/**
	 * Creates a mapper that reads JSON decimals without losing digits. Use it
	 * wherever configuration documents are parsed from text.
	 */
	public static ObjectMapper documentMapper() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
		mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
		return mapper;
	}

	public ObjectNode toDocument(QueryAssembly query) {
		ObjectNode json = mapper.createObjectNode();

		Set<TableReference> joined = Collections.newSetFromMap(new IdentityHashMap<>());
		query.joins().forEach(join -> joined.add(join.rightTable()));

		ArrayNode tables = json.putArray("tables");
		int joinsSeen = 0;
		for (TableReference table : query.tables()) {
			if (joined.contains(table)) {
				joinsSeen++;
				continue;
			}
			ObjectNode t = tables.addObject();
			t.put("name", table.name());
			t.put("alias", table.alias());
			putStrings(t.putArray("fields"), table.selectedFields());
			if (joinsSeen > 0) {
				t.put(AFTER_JOIN, joinsSeen);
			}
		}

		ArrayNode joins = json.putArray("joins");
		for (JoinSpec join : query.joins()) {
			ObjectNode j = joins.addObject();
			j.put("leftAlias", join.leftAlias());
			j.put("rightTable", join.rightTable().name());
			j.put("rightAlias", join.rightTable().alias());
			j.put("joinType", join.kind().name());
			j.put("onLeft", join.leftField());
			j.put("onRight", join.rightField());
			putStrings(j.putArray("rightFields"), join.rightTable().selectedFields());
		}

		ArrayNode filters = json.putArray("filters");
		query.filters().forEach(filter -> filters.add(filterToJson(filter)));

		ArrayNode caseWhens = json.putArray("caseWhens");
		for (CaseWhenSpec caseWhen : query.caseWhens()) {
			ObjectNode c = caseWhens.addObject();
			c.put("alias", caseWhen.alias());
			ArrayNode conditions = c.putArray("conditions");
			for (CaseWhenBranch branch : caseWhen.branches()) {
				ObjectNode b = conditions.addObject();
				b.set("condition", filterToJson(branch.condition()));
				b.set("then", literalToJson(branch.thenValue()));
			}
			if (caseWhen.hasElse()) {
				c.set("elseValue", literalToJson(caseWhen.elseValue()));
			}
		}

		ArrayNode orderBys = json.putArray("orderBys");
		query.orderBys().forEach(sort -> orderBys.add(sortToJson(sort)));

		json.put("distinct", query.isDistinct());

		ObjectNode limitConfig = json.putObject("limitConfig");
		limitConfig.put("limit", query.limit() != null ? query.limit() : 0);
		limitConfig.put("offset", query.offset() != null ? query.offset() : 0);

		query.groupBy().ifPresent(groupBy -> {
			ObjectNode g = json.putObject("groupBy");
			putStrings(g.putArray("fields"), groupBy.fields());
			ArrayNode having = g.putArray("having");
			groupBy.havingConditions().forEach(condition -> having.add(filterToJson(condition)));
		});

		ArrayNode windows = json.putArray("windowFunctions");
		for (WindowFunctionSpec window : query.windowFunctions()) {
			ObjectNode w = windows.addObject();
			w.put("function", window.functionName());
			w.put("tableAlias", window.tableAlias());
			w.put("field", window.field());
			putStrings(w.putArray("partitionBy"), window.partitionBy());
			ArrayNode orderBy = w.putArray("orderBy");
			window.orderBy().forEach(sort -> orderBy.add(sortToJson(sort)));
			w.put("alias", window.alias());
		}

		return json;
	}

	public QueryAssembly fromDocument(JsonNode json) {
		if (json == null || !json.isObject()) {
			throw new ConfigurationException("Query configuration must be a JSON object");
		}
		QueryAssembly query = new QueryAssembly();

		List<JsonNode> tables = new ArrayList<>();
		elements(json, "tables").forEach(tables::add);
		List<JsonNode> joins = new ArrayList<>();
		elements(json, "joins").forEach(joins::add);

		for (int position = 0; position <= joins.size(); position++) {
			for (JsonNode t : tables) {
				if (joinsBefore(t, joins.size()) == position) {
					query.addTable(text(t, "name"), text(t, "alias"), strings(t, "fields"));
				}
			}
			if (position < joins.size()) {
				JsonNode j = joins.get(position);
				query.addJoin(text(j, "leftAlias"), text(j, "rightTable"), text(j, "rightAlias"),
						text(j, "onLeft"), text(j, "onRight"),
						enumValue(j, "joinType", JoinKind::fromKeyword), strings(j, "rightFields"));
			}
		}

		for (JsonNode f : elements(json, "filters")) {
			FilterCondition filter = filterFromJson(f);
			query.addFilter(filter.tableAlias(), filter.field(), filter.operator(), filter.value(), filter.logic());
		}

		JsonNode groupBy = json.get("groupBy");
		if (groupBy != null && groupBy.isObject()) {
			List<FilterCondition> having = new ArrayList<>();
			elements(groupBy, "having").forEach(h -> having.add(h.isNull() ? null : filterFromJson(h)));
			query.setGroupBy(strings(groupBy, "fields"), having);
		}

		for (JsonNode w : elements(json, "windowFunctions")) {
			List<SortSpec> orderBy = new ArrayList<>();
			elements(w, "orderBy").forEach(s -> orderBy.add(s.isNull() ? null : sortFromJson(s)));
			query.addWindowFunction(text(w, "function"), text(w, "tableAlias"), text(w, "field"),
					strings(w, "partitionBy"), orderBy, text(w, "alias"));
		}

		for (JsonNode c : elements(json, "caseWhens")) {
			List<CaseWhenBranch> branches = new ArrayList<>();
			for (JsonNode b : elements(c, "conditions")) {
				JsonNode condition = b.get("condition");
				if (condition == null || !(condition.isObject() || condition.isNull())) {
					throw new ConfigurationException("CASE branch of '" + text(c, "alias") + "' has no condition");
				}
				FilterCondition when = condition.isNull() ? null : filterFromJson(condition);
				branches.add(new CaseWhenBranch(when, literalFromJson(b.get("then"))));
			}
			Literal elseValue = c.has("elseValue") ? literalFromJson(c.get("elseValue")) : null;
			query.addCaseWhen(text(c, "alias"), branches, elseValue);
		}

		for (JsonNode s : elements(json, "orderBys")) {
			SortSpec sort = sortFromJson(s);
			query.addOrderBy(sort.tableAlias(), sort.field(), sort.direction());
		}

		query.setDistinct(json.path("distinct").asBoolean(false));

		JsonNode limitConfig = json.path("limitConfig");
		query.setLimit(positionOrAbsent(limitConfig, "limit"), positionOrAbsent(limitConfig, "offset"));

		return query;
	}

	public String toJson(QueryAssembly query) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(query));
		} catch (JsonProcessingException e) {
			throw new ConfigurationException("Failed to write query configuration", e);
		}
	}

	public QueryAssembly fromJson(String json) {
		JsonNode document;
		try {
			document = mapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new ConfigurationException("Query configuration is not valid JSON", e);
		}
		return fromDocument(document);
	}

	private JsonNode filterToJson(FilterCondition filter) {
		if (filter == null) {
			return mapper.getNodeFactory().nullNode();
		}
		ObjectNode f = mapper.createObjectNode();
		f.put("tableAlias", filter.tableAlias());
		f.put("field", filter.field());
		f.put("operator", filter.operator() != null ? filter.operator().name() : null);
		f.set("value", literalToJson(filter.value()));
		f.put("logic", filter.logic().name());
		return f;
	}

	private FilterCondition filterFromJson(JsonNode f) {
		return new FilterCondition(text(f, "tableAlias"), text(f, "field"),
				enumValue(f, "operator", FilterOperator::valueOf),
				literalFromJson(f.get("value")),
				enumValue(f, "logic", LogicOperator::valueOf));
	}

	private JsonNode sortToJson(SortSpec sort) {
		if (sort == null) {
			return mapper.getNodeFactory().nullNode();
		}
		ObjectNode s = mapper.createObjectNode();
		s.put("tableAlias", sort.tableAlias());
		s.put("field", sort.field());
		s.put("direction", sort.direction().name());
		return s;
	}

	private SortSpec sortFromJson(JsonNode s) {
		return new SortSpec(text(s, "tableAlias"), text(s, "field"),
				enumValue(s, "direction", SortDirection::valueOf));
	}

	JsonNode literalToJson(Literal literal) {
		JsonNodeFactory nodes = mapper.getNodeFactory();
		if (literal instanceof Literal.Text text) {
			return nodes.textNode(text.value());
		}
		if (literal instanceof Literal.Numeric numeric) {
			return numberNode(nodes, numeric.value());
		}
		if (literal instanceof Literal.Bool bool) {
			return nodes.booleanNode(bool.value());
		}
		if (literal instanceof Literal.Sequence sequence) {
			ArrayNode array = nodes.arrayNode();
			sequence.values().forEach(element -> array.add(literalToJson(element)));
			return array;
		}
		if (literal instanceof Literal.Raw raw) {
			return nodes.objectNode().put(RAW, raw.value());
		}
		return nodes.nullNode();
	}

	Literal literalFromJson(JsonNode node) {
		if (node == null || node.isNull() || node.isMissingNode()) {
			return Literal.NULL;
		}
		if (node.isTextual()) {
			return new Literal.Text(node.asText());
		}
		if (node.isNumber()) {
			return new Literal.Numeric(numberFromJson(node));
		}
		if (node.isBoolean()) {
			return new Literal.Bool(node.booleanValue());
		}
		if (node.isArray()) {
			List<Literal> values = new ArrayList<>();
			node.forEach(element -> values.add(literalFromJson(element)));
			return new Literal.Sequence(values);
		}
		if (node.isObject() && node.has(RAW)) {
			return new Literal.Raw(node.get(RAW).asText());
		}
		throw new ConfigurationException("Unsupported literal value: " + node);
	}

	private static JsonNode numberNode(JsonNodeFactory nodes, Number value) {
		if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return nodes.numberNode(value.intValue());
		}
		if (value instanceof Long) {
			return nodes.numberNode(value.longValue());
		}
		if (value instanceof BigInteger bigInteger) {
			return nodes.numberNode(bigInteger);
		}
		if (value instanceof BigDecimal bigDecimal) {
			return DecimalNode.valueOf(bigDecimal);
		}
		if (value instanceof Float) {
			return nodes.numberNode(value.floatValue());
		}
		if (value instanceof Double) {
			return nodes.numberNode(value.doubleValue());
		}
		return DecimalNode.valueOf(new BigDecimal(value.toString()));
	}

	/**
	 * Reads a JSON number back into the value it was written from. A decimal that
	 * is exactly the text of a {@code double} comes back as that double; any other
	 * decimal stays a {@link BigDecimal} with its scale intact.
	 */
	private static Number numberFromJson(JsonNode node) {
		if (!node.isBigDecimal()) {
			return node.numberValue();
		}
		BigDecimal decimal = node.decimalValue();
		double approximation = decimal.doubleValue();
		if (Double.isFinite(approximation) && new BigDecimal(Double.toString(approximation)).equals(decimal)) {
			return approximation;
		}
		return decimal;
	}

	private static int joinsBefore(JsonNode table, int joinCount) {
		return Math.max(0, Math.min(table.path(AFTER_JOIN).asInt(0), joinCount));
	}

	private static <E extends Enum<E>> E enumValue(JsonNode node, String key, Function<String, E> parser) {
		String name = text(node, key);
		if (name == null || name.isEmpty()) {
			return null;
		}
		try {
			return parser.apply(name);
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException("Unknown " + key + " '" + name + "'", e);
		}
	}

	private static Integer positionOrAbsent(JsonNode limitConfig, String key) {
		JsonNode value = limitConfig.get(key);
		if (value == null || value.isNull() || value.asInt() == 0) {
			return null;
		}
		return value.asInt();
	}

	private static String text(JsonNode node, String key) {
		JsonNode value = node.get(key);
		return value != null && !value.isNull() ? value.asText() : null;
	}

	private static List<String> strings(JsonNode node, String key) {
		List<String> values = new ArrayList<>();
		elements(node, key).forEach(value -> values.add(value.asText()));
		return values;
	}

	private static Iterable<JsonNode> elements(JsonNode node, String key) {
		JsonNode value = node.get(key);
		if (value == null || value.isNull()) {
			return List.of();
		}
		if (!value.isArray()) {
			throw new ConfigurationException("'" + key + "' must be an array");
		}
		return value;
	}

	private static void putStrings(ArrayNode array, List<String> values) {
		values.forEach(array::add);
	}
}
