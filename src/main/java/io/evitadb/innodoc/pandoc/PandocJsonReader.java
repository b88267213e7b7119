package io.evitadb.innodoc.pandoc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.innodoc.ast.Attr;
import io.evitadb.innodoc.ast.BulletList;
import io.evitadb.innodoc.ast.Code;
import io.evitadb.innodoc.ast.CodeBlock;
import io.evitadb.innodoc.ast.DefinitionList;
import io.evitadb.innodoc.ast.Div;
import io.evitadb.innodoc.ast.Emph;
import io.evitadb.innodoc.ast.Header;
import io.evitadb.innodoc.ast.Image;
import io.evitadb.innodoc.ast.LineBreak;
import io.evitadb.innodoc.ast.Link;
import io.evitadb.innodoc.ast.Math;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.OrderedList;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Plain;
import io.evitadb.innodoc.ast.Quoted;
import io.evitadb.innodoc.ast.SoftBreak;
import io.evitadb.innodoc.ast.Space;
import io.evitadb.innodoc.ast.Span;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.ast.Strong;
import io.evitadb.innodoc.ast.Table;
import io.evitadb.innodoc.ast.UnknownNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads pandoc JSON (API 1.20 layout) into the typed {@link Node} model.
 *
 * Each node is an object `{"t": kind, "c": payload}`. A payload that does not have the shape its
 * kind requires is fatal and reported with the JSON pointer of the offending value. Kinds that are
 * not part of the known set are kept as {@link UnknownNode} with their raw payload.
 */
public final class PandocJsonReader {

	private static final String BLOCKS = "blocks";
	private static final String META = "meta";
	private static final String API_VERSION = "pandoc-api-version";

	@Nonnull
	private final ObjectMapper objectMapper;

	/**
	 * Creates a reader with a default object mapper.
	 */
	public PandocJsonReader() {
		this(new ObjectMapper());
	}

	/**
	 * Creates a reader using the given object mapper.
	 *
	 * @param objectMapper mapper used to parse raw JSON
	 */
	public PandocJsonReader(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Reads a pandoc JSON document from a file.
	 *
	 * @param file the pandoc output file
	 * @return the parsed document
	 * @throws IOException            if the file cannot be read
	 * @throws DocumentParseException if the content is not a valid pandoc document
	 */
	@Nonnull
	public PandocDocument read(@Nonnull Path file) throws IOException, DocumentParseException {
		Objects.requireNonNull(file, "file must not be null");
		return read(Files.readString(file));
	}

	/**
	 * Reads a pandoc JSON document from a string.
	 *
	 * @param json the document JSON
	 * @return the parsed document
	 * @throws DocumentParseException if the content is not a valid pandoc document
	 */
	@Nonnull
	public PandocDocument read(@Nonnull String json) throws DocumentParseException {
		Objects.requireNonNull(json, "json must not be null");
		final JsonNode root;
		try {
			root = this.objectMapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new DocumentParseException("Unparsable JSON: " + e.getOriginalMessage(), "", e);
		}
		return readDocument(root);
	}

	/**
	 * Converts an already parsed JSON tree into a document.
	 *
	 * @param root the JSON root object
	 * @return the parsed document
	 * @throws DocumentParseException if the tree is not a valid pandoc document
	 */
	@Nonnull
	public PandocDocument readDocument(@Nullable JsonNode root) throws DocumentParseException {
		if (root == null || !root.isObject()) {
			throw new DocumentParseException("Document must be a JSON object", "");
		}

		final List<Integer> apiVersion = new ArrayList<>();
		final JsonNode version = root.get(API_VERSION);
		if (version != null && version.isArray()) {
			for (int i = 0; i < version.size(); i++) {
				apiVersion.add(requireInt(version.get(i), "/" + API_VERSION + "/" + i));
			}
		}

		final JsonNode metaNode = root.get(META);
		final ObjectNode meta;
		if (metaNode == null || metaNode.isNull()) {
			meta = this.objectMapper.createObjectNode();
		} else if (metaNode.isObject()) {
			meta = (ObjectNode) metaNode;
		} else {
			throw new DocumentParseException("Expected metadata object", "/" + META);
		}

		final JsonNode blocks = root.get(BLOCKS);
		if (blocks == null) {
			throw new DocumentParseException("Document has no blocks", "");
		}

		return new PandocDocument(
			apiVersion,
			meta,
			readTitle(meta),
			readNodes(blocks, "/" + BLOCKS)
		);
	}

	/**
	 * Reads the `title` metadata field. Both `MetaInlines` and `MetaString` are understood,
	 * anything else is treated as no title.
	 */
	@Nonnull
	private List<Node> readTitle(@Nonnull ObjectNode meta) throws DocumentParseException {
		final JsonNode title = meta.get("title");
		if (title == null || !title.isObject()) {
			return List.of();
		}
		final String pointer = "/" + META + "/title/c";
		final String kind = title.path("t").asText("");
		switch (kind) {
			case "MetaInlines":
				return readNodes(title.get("c"), pointer);
			case "MetaString":
				return List.of(new Str(requireText(title.get("c"), pointer)));
			default:
				return List.of();
		}
	}

	/**
	 * Reads a JSON array of nodes.
	 *
	 * @param json    the array
	 * @param pointer JSON pointer of the array
	 * @return nodes in input order
	 * @throws DocumentParseException if the value is not an array or contains a malformed node
	 */
	@Nonnull
	public List<Node> readNodes(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		final JsonNode array = requireArray(json, pointer, 0);
		final List<Node> nodes = new ArrayList<>(array.size());
		for (int i = 0; i < array.size(); i++) {
			nodes.add(readNode(array.get(i), pointer + "/" + i));
		}
		return nodes;
	}

	/**
	 * Reads a single node.
	 *
	 * @param json    the node object
	 * @param pointer JSON pointer of the node
	 * @return the typed node
	 * @throws DocumentParseException if the node is malformed
	 */
	@Nonnull
	public Node readNode(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		if (json == null || !json.isObject()) {
			throw new DocumentParseException("Expected node object", pointer);
		}
		final JsonNode tag = json.get("t");
		if (tag == null || !tag.isTextual()) {
			throw new DocumentParseException("Node has no kind tag", pointer);
		}
		final JsonNode c = json.get("c");
		final String cp = pointer + "/c";

		switch (tag.asText()) {
			case Header.KIND: {
				final JsonNode payload = requireArray(c, cp, 3);
				return new Header(
					requireInt(payload.get(0), cp + "/0"),
					readAttr(payload.get(1), cp + "/1"),
					readNodes(payload.get(2), cp + "/2")
				);
			}
			case Para.KIND:
				return new Para(readNodes(c, cp));
			case Plain.KIND:
				return new Plain(readNodes(c, cp));
			case Div.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				return new Div(readAttr(payload.get(0), cp + "/0"), readNodes(payload.get(1), cp + "/1"));
			}
			case Span.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				return new Span(readAttr(payload.get(0), cp + "/0"), readNodes(payload.get(1), cp + "/1"));
			}
			case Link.KIND: {
				final JsonNode payload = requireArray(c, cp, 3);
				final JsonNode target = requireArray(payload.get(2), cp + "/2", 2);
				return new Link(
					readAttr(payload.get(0), cp + "/0"),
					readNodes(payload.get(1), cp + "/1"),
					requireText(target.get(0), cp + "/2/0"),
					requireText(target.get(1), cp + "/2/1")
				);
			}
			case Image.KIND: {
				final JsonNode payload = requireArray(c, cp, 3);
				final JsonNode target = requireArray(payload.get(2), cp + "/2", 2);
				return new Image(
					readAttr(payload.get(0), cp + "/0"),
					readNodes(payload.get(1), cp + "/1"),
					requireText(target.get(0), cp + "/2/0"),
					requireText(target.get(1), cp + "/2/1")
				);
			}
			case BulletList.KIND:
				return new BulletList(readBlockSequences(c, cp));
			case OrderedList.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				final JsonNode listAttributes = requireArray(payload.get(0), cp + "/0", 3);
				return new OrderedList(
					new OrderedList.ListAttributes(
						requireInt(listAttributes.get(0), cp + "/0/0"),
						requireTag(listAttributes.get(1), cp + "/0/1"),
						requireTag(listAttributes.get(2), cp + "/0/2")
					),
					readBlockSequences(payload.get(1), cp + "/1")
				);
			}
			case DefinitionList.KIND:
				return new DefinitionList(readDefinitionItems(c, cp));
			case Table.KIND:
				return readTable(c, cp);
			case Emph.KIND:
				return new Emph(readNodes(c, cp));
			case Strong.KIND:
				return new Strong(readNodes(c, cp));
			case Quoted.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				return new Quoted(requireTag(payload.get(0), cp + "/0"), readNodes(payload.get(1), cp + "/1"));
			}
			case CodeBlock.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				return new CodeBlock(readAttr(payload.get(0), cp + "/0"), requireText(payload.get(1), cp + "/1"));
			}
			case Code.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				return new Code(readAttr(payload.get(0), cp + "/0"), requireText(payload.get(1), cp + "/1"));
			}
			case Str.KIND:
				return new Str(requireText(c, cp));
			case Space.KIND:
				return new Space();
			case SoftBreak.KIND:
				return new SoftBreak();
			case LineBreak.KIND:
				return new LineBreak();
			case Math.KIND: {
				final JsonNode payload = requireArray(c, cp, 2);
				return new Math(requireTag(payload.get(0), cp + "/0"), requireText(payload.get(1), cp + "/1"));
			}
			default:
				return new UnknownNode(tag.asText(), c);
		}
	}

	/**
	 * Reads `[identifier, [classes], [[key, value], ...]]`.
	 */
	@Nonnull
	private Attr readAttr(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		final JsonNode attr = requireArray(json, pointer, 3);
		final String identifier = requireText(attr.get(0), pointer + "/0");

		final JsonNode classesJson = requireArray(attr.get(1), pointer + "/1", 0);
		final List<String> classes = new ArrayList<>(classesJson.size());
		for (int i = 0; i < classesJson.size(); i++) {
			classes.add(requireText(classesJson.get(i), pointer + "/1/" + i));
		}

		final JsonNode attributesJson = requireArray(attr.get(2), pointer + "/2", 0);
		final List<Attr.Attribute> attributes = new ArrayList<>(attributesJson.size());
		for (int i = 0; i < attributesJson.size(); i++) {
			final String pairPointer = pointer + "/2/" + i;
			final JsonNode pair = requireArray(attributesJson.get(i), pairPointer, 2);
			attributes.add(new Attr.Attribute(
				requireText(pair.get(0), pairPointer + "/0"),
				requireText(pair.get(1), pairPointer + "/1")
			));
		}
		return new Attr(identifier, classes, attributes);
	}

	@Nonnull
	private List<List<Node>> readBlockSequences(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		final JsonNode array = requireArray(json, pointer, 0);
		final List<List<Node>> sequences = new ArrayList<>(array.size());
		for (int i = 0; i < array.size(); i++) {
			sequences.add(readNodes(array.get(i), pointer + "/" + i));
		}
		return sequences;
	}

	/**
	 * Reads `[[term inlines, [[definition blocks], ...]], ...]`.
	 */
	@Nonnull
	private List<DefinitionList.Item> readDefinitionItems(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		final JsonNode array = requireArray(json, pointer, 0);
		final List<DefinitionList.Item> items = new ArrayList<>(array.size());
		for (int i = 0; i < array.size(); i++) {
			final String itemPointer = pointer + "/" + i;
			final JsonNode item = requireArray(array.get(i), itemPointer, 2);
			items.add(new DefinitionList.Item(
				readNodes(item.get(0), itemPointer + "/0"),
				readBlockSequences(item.get(1), itemPointer + "/1")
			));
		}
		return items;
	}

	/**
	 * Reads `[caption, [alignments], [widths], [header cells], [rows]]`.
	 */
	@Nonnull
	private Table readTable(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		final JsonNode payload = requireArray(json, pointer, 5);

		final JsonNode alignmentsJson = requireArray(payload.get(1), pointer + "/1", 0);
		final List<String> alignments = new ArrayList<>(alignmentsJson.size());
		for (int i = 0; i < alignmentsJson.size(); i++) {
			alignments.add(requireTag(alignmentsJson.get(i), pointer + "/1/" + i));
		}

		final JsonNode widthsJson = requireArray(payload.get(2), pointer + "/2", 0);
		final List<Double> widths = new ArrayList<>(widthsJson.size());
		for (int i = 0; i < widthsJson.size(); i++) {
			final JsonNode width = widthsJson.get(i);
			if (!width.isNumber()) {
				throw new DocumentParseException("Expected number", pointer + "/2/" + i);
			}
			widths.add(width.asDouble());
		}

		final JsonNode rowsJson = requireArray(payload.get(4), pointer + "/4", 0);
		final List<List<List<Node>>> rows = new ArrayList<>(rowsJson.size());
		for (int i = 0; i < rowsJson.size(); i++) {
			rows.add(readBlockSequences(rowsJson.get(i), pointer + "/4/" + i));
		}

		return new Table(
			readNodes(payload.get(0), pointer + "/0"),
			alignments,
			widths,
			readBlockSequences(payload.get(3), pointer + "/3"),
			rows
		);
	}

	@Nonnull
	private static JsonNode requireArray(@Nullable JsonNode json, @Nonnull String pointer, int minSize) throws DocumentParseException {
		if (json == null || !json.isArray()) {
			throw new DocumentParseException("Expected array", pointer);
		}
		if (json.size() < minSize) {
			throw new DocumentParseException(
				"Expected at least " + minSize + " elements but found " + json.size(), pointer
			);
		}
		return json;
	}

	@Nonnull
	private static String requireText(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		if (json == null || !json.isTextual()) {
			throw new DocumentParseException("Expected string", pointer);
		}
		return json.asText();
	}

	private static int requireInt(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		if (json == null || !json.canConvertToInt() || !json.isIntegralNumber()) {
			throw new DocumentParseException("Expected integer", pointer);
		}
		return json.asInt();
	}

	/**
	 * Reads a constructor-only value such as `{"t": "InlineMath"}` and returns its tag.
	 */
	@Nonnull
	private static String requireTag(@Nullable JsonNode json, @Nonnull String pointer) throws DocumentParseException {
		if (json == null || !json.isObject()) {
			throw new DocumentParseException("Expected tagged object", pointer);
		}
		return requireText(json.get("t"), pointer + "/t");
	}
}
