package works.jsonkeep.jackson;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.IntNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReviverReplacerTest {
	static final String DOCUMENT = "{\n  \"a\": {\n    \"b\": 1\n  },\n  \"c\": [\n    2,\n    3\n  ]\n}\n";

	@Test
	void reviver_visitsChildrenFirst() {
		List<String> keys = new ArrayList<>();
		JsonKeep.decode(DOCUMENT, (key, value) -> {
			keys.add(key);
			return value;
		});
		assertThat(keys, contains("b", "a", "0", "1", "c", ""));
	}

	@Test
	void reviver_removesMembersAndNullsElements() {
		JsonNode value = JsonKeep.decode(DOCUMENT, (key, node) ->
			(key.equals("b") || (node.isInt() && node.intValue() == 2)) ? null : node);
		assertEquals("{\n  \"a\": {},\n  \"c\": [\n    null,\n    3\n  ]\n}\n", JsonKeep.encode(value));
	}

	@Test
	void reviver_replacesValues() {
		JsonNode value = JsonKeep.decode(DOCUMENT, (key, node) ->
			node.isInt() ? IntNode.valueOf(node.intValue() * 10) : node);
		assertEquals("{\n  \"a\": {\n    \"b\": 10\n  },\n  \"c\": [\n    20,\n    30\n  ]\n}\n", JsonKeep.encode(value));
	}

	@Test
	void revivedRoot_isTheTrackedValue() {
		ObjectNode replacement = JsonNodeFactory.instance.objectNode().put("replaced", true);
		JsonNode value = JsonKeep.decode(DOCUMENT, (key, node) -> key.isEmpty() ? replacement : node);
		assertSame(replacement, value);
		assertTrue(JsonKeep.isTracked(replacement));
		assertEquals("{\n  \"replaced\": true\n}\n", JsonKeep.encode(value));
	}

	@Test
	void rootRevivedToScalar_notTracked() {
		JsonNode value = JsonKeep.decode(DOCUMENT, (key, node) -> key.isEmpty() ? IntNode.valueOf(7) : node);
		assertEquals(7, value.intValue());
		assertFalse(JsonKeep.isTracked(value));
	}

	@Test
	void rootRevivedToNull_missing() {
		JsonNode value = JsonKeep.decode(DOCUMENT, (key, node) -> key.isEmpty() ? null : node);
		assertTrue(value.isMissingNode());
		assertFalse(JsonKeep.isTracked(value));
	}

	@Test
	void replacer_visitsContainersFirst() {
		List<String> keys = new ArrayList<>();
		JsonKeep.encode(JsonKeep.decode(DOCUMENT), (key, value) -> {
			keys.add(key);
			return value;
		});
		assertThat(keys, contains("", "a", "b", "c", "0", "1"));
	}

	@Test
	void replacer_omitsMembersAndNullsElements() {
		JsonNode value = JsonKeep.decode("[1,2,{\"x\":2,\"y\":3}]");
		String text = JsonKeep.encode(value, (key, node) -> (node.isInt() && node.intValue() == 2) ? null : node);
		assertEquals("[1,null,{\"y\":3}]", text);
	}

	@Test
	void replacer_keepsFormattingOfOriginal() {
		JsonNode value = JsonKeep.decode(DOCUMENT.replace("\n", "\r\n"));
		String text = JsonKeep.encode(value, (key, node) -> key.equals("c") ? null : node);
		assertEquals("{\r\n  \"a\": {\r\n    \"b\": 1\r\n  }\r\n}\r\n", text);
	}

	@Test
	void replacer_leavesOriginalAlone() {
		JsonNode value = JsonKeep.decode(DOCUMENT);
		JsonNode before = value.deepCopy();
		JsonKeep.encode(value, (key, node) -> key.equals("a") ? null : node);
		assertEquals(before, value);
		assertEquals(DOCUMENT, JsonKeep.encode(value));
	}

	@Test
	void replacer_seesItsOwnReplacements() {
		JsonNode value = JsonKeep.decode("{\"a\":1}");
		List<String> keys = new ArrayList<>();
		String text = JsonKeep.encode(value, (key, node) -> {
			keys.add(key);
			if (key.equals("a")) {
				return JsonNodeFactory.instance.objectNode().put("inner", 2);
			}
			return node;
		});
		assertEquals("{\"a\":{\"inner\":2}}", text);
		assertThat(keys, contains("", "a", "inner"));
	}

	@Test
	void replacerOmittingRoot_throws() {
		JsonNode value = JsonKeep.decode(DOCUMENT);
		assertThrows(IllegalArgumentException.class, () -> JsonKeep.encode(value, (key, node) -> null));
	}
}
