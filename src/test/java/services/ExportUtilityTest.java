package services;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import classes.Header;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExportUtilityTest {

	private static List<Header<String>> headers(String... labels) {
		return Arrays.stream(labels).map(l -> Header.<String>of(l, s -> s)).collect(Collectors.toList());
	}

	private static List<String> labels(List<Header<String>> headers) {
		return headers.stream().map(Header::getLabel).collect(Collectors.toList());
	}

	@Test
	void renderCellMapsNullToEmpty() {
		assertEquals("", ExportUtility.renderCell(null));
		assertEquals("5", ExportUtility.renderCell(5));
		assertEquals("2.5", ExportUtility.renderCell(2.5));
		assertEquals("true", ExportUtility.renderCell(Boolean.TRUE));
		assertEquals("", ExportUtility.renderCell(""));
	}

	@Test
	void renderCellReadsMapKeys() {
		Map<String, Object> record = new HashMap<>();
		record.put("present", "x");
		record.put("nothing", null);

		assertEquals("x", ExportUtility.renderCell(record, "present"));
		assertEquals("", ExportUtility.renderCell(record, "nothing"));
		assertEquals("", ExportUtility.renderCell(record, "absent"));
	}

	@Test
	void sortWithoutPreferenceKeepsDeclarationOrder() {
		assertEquals(List.of("a", "b", "c"), labels(ExportUtility.sortHeaders(headers("a", "b", "c"), null)));
		assertEquals(List.of("a", "b", "c"), labels(ExportUtility.sortHeaders(headers("a", "b", "c"), List.of())));
	}

	@Test
	void sortFollowsFullPreference() {
		assertEquals(List.of("c", "b", "a"), labels(ExportUtility.sortHeaders(headers("a", "b", "c"), List.of("c", "b", "a"))));
	}

	@Test
	void unlistedHeadersKeepRelativeOrderAtTheEnd() {
		List<Header<String>> sorted = ExportUtility.sortHeaders(headers("d", "a", "e", "b", "c"), List.of("b", "a"));

		assertEquals(List.of("b", "a", "d", "e", "c"), labels(sorted));
	}

	@Test
	void unknownAndDuplicatePreferenceEntriesNeitherAddNorDrop() {
		List<Header<String>> sorted = ExportUtility.sortHeaders(headers("a", "b", "c"), List.of("zz", "c", "c", "a"));

		assertEquals(List.of("c", "a", "b"), labels(sorted));
	}

	@Test
	void duplicateLabelsStayStable() {
		List<Header<String>> declared = headers("x", "y", "x");

		List<Header<String>> sorted = ExportUtility.sortHeaders(declared, List.of("x"));

		assertEquals(List.of("x", "x", "y"), labels(sorted));
		assertEquals(declared.get(0), sorted.get(0));
		assertEquals(declared.get(2), sorted.get(1));
	}

	@Test
	void orderIndexIsPreferenceSizeWhenUnlisted() {
		assertEquals(0, ExportUtility.orderIndex(List.of("a", "b"), "a"));
		assertEquals(2, ExportUtility.orderIndex(List.of("a", "b"), "c"));
	}
}
