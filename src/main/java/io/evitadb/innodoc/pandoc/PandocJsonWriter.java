package io.evitadb.innodoc.pandoc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
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
import io.evitadb.innodoc.ast.NodeVisitor;
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
import java.util.List;
import java.util.Objects;

/**
 * Writes the typed {@link Node} model back to pandoc JSON (API 1.20 layout).
 * Output of this writer is accepted by {@link PandocJsonReader} and by `pandoc --from=json`.
 */
public final class PandocJsonWriter {

	/** API version announced to pandoc when converting sections. */
	public static final List<Integer> API_VERSION = List.of(1, 20);

	@Nonnull
	private final ObjectMapper objectMapper;

	public PandocJsonWriter() {
		this(new ObjectMapper());
	}

	public PandocJsonWriter(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	/**
	 * Builds a standalone pandoc document from a block sequence and metadata.
	 *
	 * @param blocks block nodes of the document
	 * @param meta   metadata object, may be null for none
	 * @return the document JSON
	 */
	@Nonnull
	public ObjectNode writeDocument(@Nonnull List<Node> blocks, @Nullable ObjectNode meta) {
		Objects.requireNonNull(blocks, "blocks must not be null");
		final ObjectNode document = this.objectMapper.createObjectNode();
		document.set("blocks", writeNodes(blocks));
		final ArrayNode version = document.putArray("pandoc-api-version");
		API_VERSION.forEach(version::add);
		document.set("meta", meta == null ? this.objectMapper.createObjectNode() : meta);
		return document;
	}

	/**
	 * Creates a `MetaInlines` metadata value.
	 *
	 * @param inlines inline nodes
	 * @return the metadata value JSON
	 */
	@Nonnull
	public ObjectNode writeMetaInlines(@Nonnull List<Node> inlines) {
		final ObjectNode value = this.objectMapper.createObjectNode();
		value.put("t", "MetaInlines");
		value.set("c", writeNodes(inlines));
		return value;
	}

	/**
	 * Writes a sequence of nodes as JSON array.
	 *
	 * @param nodes nodes to write
	 * @return the JSON array
	 */
	@Nonnull
	public ArrayNode writeNodes(@Nonnull List<Node> nodes) {
		final ArrayNode array = this.objectMapper.createArrayNode();
		for (final Node node : nodes) {
			array.add(writeNode(node));
		}
		return array;
	}

	/**
	 * Writes a single node.
	 *
	 * @param node the node
	 * @return the JSON object `{"t": ..., "c": ...}`
	 */
	@Nonnull
	public ObjectNode writeNode(@Nonnull Node node) {
		Objects.requireNonNull(node, "node must not be null");
		final NodeEncoder encoder = new NodeEncoder();
		node.accept(encoder);
		return encoder.result;
	}

	@Nonnull
	private ArrayNode writeAttr(@Nonnull Attr attr) {
		final ArrayNode json = this.objectMapper.createArrayNode();
		json.add(attr.getIdentifier());
		final ArrayNode classes = json.addArray();
		attr.getClasses().forEach(classes::add);
		final ArrayNode attributes = json.addArray();
		for (final Attr.Attribute attribute : attr.getAttributes()) {
			attributes.addArray().add(attribute.key()).add(attribute.value());
		}
		return json;
	}

	@Nonnull
	private ArrayNode writeBlockSequences(@Nonnull List<List<Node>> sequences) {
		final ArrayNode json = this.objectMapper.createArrayNode();
		for (final List<Node> sequence : sequences) {
			json.add(writeNodes(sequence));
		}
		return json;
	}

	@Nonnull
	private ObjectNode tag(@Nonnull String tag) {
		return this.objectMapper.createObjectNode().put("t", tag);
	}

	@Nonnull
	private ArrayNode target(@Nonnull String url, @Nonnull String title) {
		return this.objectMapper.createArrayNode().add(url).add(title);
	}

	/**
	 * Encodes one node into {@link #result}.
	 */
	private final class NodeEncoder implements NodeVisitor {

		private ObjectNode result;

		private ObjectNode start(@Nonnull Node node) {
			this.result = tag(node.getKind());
			return this.result;
		}

		private void content(@Nonnull Node node, @Nonnull JsonNode payload) {
			start(node).set("c", payload);
		}

		@Override
		public void visit(@Nonnull Header header) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(header.getLevel());
			payload.add(writeAttr(header.getAttr()));
			payload.add(writeNodes(header.getContent()));
			content(header, payload);
		}

		@Override
		public void visit(@Nonnull Para para) {
			content(para, writeNodes(para.getContent()));
		}

		@Override
		public void visit(@Nonnull Plain plain) {
			content(plain, writeNodes(plain.getContent()));
		}

		@Override
		public void visit(@Nonnull Div div) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeAttr(div.getAttr()));
			payload.add(writeNodes(div.getContent()));
			content(div, payload);
		}

		@Override
		public void visit(@Nonnull Span span) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeAttr(span.getAttr()));
			payload.add(writeNodes(span.getContent()));
			content(span, payload);
		}

		@Override
		public void visit(@Nonnull Link link) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeAttr(link.getAttr()));
			payload.add(writeNodes(link.getCaption()));
			payload.add(target(link.getUrl(), link.getTitle()));
			content(link, payload);
		}

		@Override
		public void visit(@Nonnull Image image) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeAttr(image.getAttr()));
			payload.add(writeNodes(image.getAlt()));
			payload.add(target(image.getUrl(), image.getTitle()));
			content(image, payload);
		}

		@Override
		public void visit(@Nonnull BulletList bulletList) {
			content(bulletList, writeBlockSequences(bulletList.getItems()));
		}

		@Override
		public void visit(@Nonnull OrderedList orderedList) {
			final OrderedList.ListAttributes listAttributes = orderedList.getListAttributes();
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.addArray()
				.add(listAttributes.start())
				.add(tag(listAttributes.style()))
				.add(tag(listAttributes.delimiter()));
			payload.add(writeBlockSequences(orderedList.getItems()));
			content(orderedList, payload);
		}

		@Override
		public void visit(@Nonnull DefinitionList definitionList) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			for (final DefinitionList.Item item : definitionList.getItems()) {
				payload.addArray()
					.add(writeNodes(item.term()))
					.add(writeBlockSequences(item.definitions()));
			}
			content(definitionList, payload);
		}

		@Override
		public void visit(@Nonnull Table table) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeNodes(table.getCaption()));
			final ArrayNode alignments = payload.addArray();
			table.getAlignments().forEach(alignment -> alignments.add(tag(alignment)));
			final ArrayNode widths = payload.addArray();
			table.getWidths().forEach(widths::add);
			payload.add(writeBlockSequences(table.getHeader()));
			final ArrayNode rows = payload.addArray();
			table.getRows().forEach(row -> rows.add(writeBlockSequences(row)));
			content(table, payload);
		}

		@Override
		public void visit(@Nonnull Emph emph) {
			content(emph, writeNodes(emph.getContent()));
		}

		@Override
		public void visit(@Nonnull Strong strong) {
			content(strong, writeNodes(strong.getContent()));
		}

		@Override
		public void visit(@Nonnull Quoted quoted) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(tag(quoted.getQuoteType()));
			payload.add(writeNodes(quoted.getContent()));
			content(quoted, payload);
		}

		@Override
		public void visit(@Nonnull CodeBlock codeBlock) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeAttr(codeBlock.getAttr()));
			payload.add(codeBlock.getText());
			content(codeBlock, payload);
		}

		@Override
		public void visit(@Nonnull Code code) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(writeAttr(code.getAttr()));
			payload.add(code.getText());
			content(code, payload);
		}

		@Override
		public void visit(@Nonnull Str str) {
			start(str).put("c", str.getText());
		}

		@Override
		public void visit(@Nonnull Space space) {
			start(space);
		}

		@Override
		public void visit(@Nonnull SoftBreak softBreak) {
			start(softBreak);
		}

		@Override
		public void visit(@Nonnull LineBreak lineBreak) {
			start(lineBreak);
		}

		@Override
		public void visit(@Nonnull Math math) {
			final ArrayNode payload = PandocJsonWriter.this.objectMapper.createArrayNode();
			payload.add(tag(math.getMathType()));
			payload.add(math.getText());
			content(math, payload);
		}

		@Override
		public void visit(@Nonnull UnknownNode unknown) {
			final ObjectNode json = start(unknown);
			if (unknown.getPayload() != null) {
				json.set("c", unknown.getPayload().deepCopy());
			}
		}
	}
}
