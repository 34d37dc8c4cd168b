package org.javai.querybuilder.narrative;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.querybuilder.assembly.QueryAssembly;
import org.javai.querybuilder.assembly.QueryWorkbench;
import org.javai.querybuilder.model.CaseWhenBranch;
import org.javai.querybuilder.model.FilterCondition;
import org.javai.querybuilder.model.FilterOperator;
import org.javai.querybuilder.model.LogicOperator;
import org.javai.querybuilder.model.SortDirection;
import org.javai.querybuilder.model.SortSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RequirementsTranscriberTest {

	@Test
	@DisplayName("frames an empty query with header and closing only")
	void emptyQuery() {
		assertThat(RequirementsTranscriber.transcribe(new QueryAssembly())).isEqualTo("""
				I need a SQL query with the following requirements:

				Please write the SQL query that satisfies these requirements.""");
	}

	@Test
	@DisplayName("transcribes the example query")
	void exampleQuery() {
		assertThat(RequirementsTranscriber.transcribe(QueryWorkbench.exampleQuery())).isEqualTo("""
				I need a SQL query with the following requirements:

				**Data sources**:
				- Primary table: products (alias: p)
				  Required fields: product_id, product_name, price
				- Joined table: categories (alias: c)
				  Required fields: category_name

				**Table relationships**:
				- p left join c
				  Join condition: p.category_id = c.category_id

				**Filter conditions**:
				- p.price is greater than 100

				**Result ordering**: by p.price descending

				Please write the SQL query that satisfies these requirements.""");
	}

	@Test
	@DisplayName("transcribes every section in order")
	void everySection() {
		QueryAssembly query = new QueryAssembly();
		query.setDistinct(true);
		query.addTable("orders", "o", List.of("customer_id"));
		query.addFilter("o", "status", FilterOperator.IN, List.of("paid", "shipped"));
		query.addFilter("o", "total", FilterOperator.BETWEEN, List.of(10, 500), LogicOperator.OR);
		query.setGroupBy(List.of("o.customer_id"),
				List.of(new FilterCondition("o", "total", FilterOperator.GREATER, 100)));
		query.addCaseWhen("size", List.of(
				new CaseWhenBranch(new FilterCondition("o", "total", FilterOperator.GREATER, 1000), "large")),
				"small");
		query.addWindowFunction("SUM", "o", "total", List.of("o.customer_id"),
				List.of(new SortSpec("o", "created_at", SortDirection.ASC)), "running_total");
		query.addOrderBy("o", "customer_id", SortDirection.DESC);
		query.setLimit(10, 5);

		assertThat(RequirementsTranscriber.transcribe(query)).isEqualTo("""
				I need a SQL query with the following requirements:

				**Deduplication**: the result must not contain duplicate rows

				**Data sources**:
				- Primary table: orders (alias: o)
				  Required fields: customer_id

				**Filter conditions**:
				- o.status is one of paid, shipped
				- OR o.total is between 10 and 500

				**Grouping**: group by o.customer_id
				- HAVING condition: o.total > 100

				**Computed columns**:
				- Create column size, assigned as follows:
				  Condition 1: if o.total > 1000, the value is large
				  Otherwise the value is small

				**Window functions**:
				- Compute SUM of o.total, named running_total
				  Partition by o.customer_id
				  Order by o.created_at ascending

				**Result ordering**: by o.customer_id descending

				**Row limit**: return only 10 rows, skipping the first 5

				Please write the SQL query that satisfies these requirements.""");
	}
}
