package org.javai.sqlassist.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the documentation overlay in its wire shape:
 *
 * <pre>{@code
 * {
 *   "users": {
 *     "description": "Registered customers",
 *     "columns": { "email": "Login address" }
 *   }
 * }
 * }</pre>
 *
 * <p>Missing or null {@code description} and {@code columns} read as empty. Entries that are not
 * JSON objects are skipped.</p>
 */
public final class DocumentationJson {

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private DocumentationJson() {
	}

	public static Documentation read(String json) {
		if (json == null || json.isBlank()) {
			return Documentation.empty();
		}
		try {
			return read(JSON_MAPPER.readTree(json));
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Documentation is not valid JSON: " + e.getOriginalMessage(), e);
		}
	}

	public static Documentation read(JsonNode root) {
		if (root == null || !root.isObject()) {
			return Documentation.empty();
		}
		Map<String, Documentation.TableDocumentation> tables = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> entry = fields.next();
			JsonNode tableNode = entry.getValue();
			if (!tableNode.isObject()) {
				continue;
			}
			tables.put(entry.getKey(), readTable(tableNode));
		}
		return new Documentation(tables);
	}

	public static String write(Documentation documentation) {
		ObjectNode root = JSON_MAPPER.createObjectNode();
		if (documentation != null) {
			documentation.tables().forEach((tableName, table) -> {
				ObjectNode tableNode = root.putObject(tableName);
				tableNode.put("description", table.description());
				ObjectNode columnsNode = tableNode.putObject("columns");
				table.columns().forEach(columnsNode::put);
			});
		}
		try {
			return JSON_MAPPER.writeValueAsString(root);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialise documentation", e);
		}
	}

	private static Documentation.TableDocumentation readTable(JsonNode tableNode) {
		JsonNode descriptionNode = tableNode.get("description");
		String description = descriptionNode != null && !descriptionNode.isNull() ? descriptionNode.asText() : "";
		Map<String, String> columns = new LinkedHashMap<>();
		JsonNode columnsNode = tableNode.get("columns");
		if (columnsNode != null && columnsNode.isObject()) {
			columnsNode.fields().forEachRemaining(column -> {
				if (!column.getValue().isNull()) {
					columns.put(column.getKey(), column.getValue().asText());
				}
			});
		}
		return new Documentation.TableDocumentation(description, columns);
	}
}
