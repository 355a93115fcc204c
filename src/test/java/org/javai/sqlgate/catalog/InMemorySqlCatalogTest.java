package org.javai.sqlgate.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.javai.sqlgate.catalog.SqlCatalog.SqlColumn;
import org.javai.sqlgate.catalog.SqlCatalog.SqlTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemorySqlCatalogTest {

	private InMemorySqlCatalog catalog;

	@BeforeEach
	void setUp() {
		catalog = InMemorySqlCatalog.builder()
				.addColumn("readings", "id", "INTEGER")
				.addColumn("readings", "country", "VARCHAR")
				.addColumn("readings", "concentration", "DOUBLE")
				.addTable("sites", "id", "name", "country")
				.build();
	}

	@Test
	@DisplayName("keeps tables in insertion order")
	void keepsTableOrder() {
		assertThat(catalog.tableNames()).containsExactly("readings", "sites");
		assertThat(catalog.tables()).containsKeys("readings", "sites");
	}

	@Test
	@DisplayName("flattens column names across tables without duplicates")
	void flattensColumns() {
		assertThat(catalog.columnNames()).containsExactly("id", "country", "concentration", "name");
	}

	@Test
	@DisplayName("looks up names ignoring case")
	void ignoresCase() {
		assertThat(catalog.hasTable("READINGS")).isTrue();
		assertThat(catalog.hasColumn("Concentration")).isTrue();
		assertThat(catalog.hasTable("measurements")).isFalse();
		assertThat(catalog.hasColumn(null)).isFalse();
	}

	@Test
	@DisplayName("finds table and column metadata")
	void findsMetadata() {
		SqlTable readings = catalog.findTable("Readings").orElseThrow();

		assertThat(readings.columns()).hasSize(3);
		assertThat(readings.findColumn("COUNTRY")).contains(new SqlColumn("country", "VARCHAR"));
		assertThat(catalog.findTable("sites").flatMap(t -> t.findColumn("concentration"))).isEmpty();
	}

	@Test
	@DisplayName("exposes unmodifiable views")
	void isImmutable() {
		assertThatThrownBy(() -> catalog.tableNames().add("other"))
				.isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> catalog.tables().clear())
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	@DisplayName("empty catalog knows nothing")
	void emptyCatalog() {
		InMemorySqlCatalog empty = InMemorySqlCatalog.empty();

		assertThat(empty.tables()).isEmpty();
		assertThat(empty.hasTable("readings")).isFalse();
		assertThat(empty.hasColumn("country")).isFalse();
	}

	@Test
	@DisplayName("rejects blank names")
	void rejectsBlankNames() {
		assertThatThrownBy(() -> InMemorySqlCatalog.builder().addTable(" "))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> InMemorySqlCatalog.builder().addColumn("readings", "", null).build())
				.isInstanceOf(IllegalArgumentException.class);
	}
}
