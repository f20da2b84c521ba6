package works.xmlcodec.jackson;

import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.xmlcodec.Namespace;
import works.xmlcodec.XmlDocument;
import works.xmlcodec.codec.DefaultXmlEncoder;
import works.xmlcodec.codec.XmlEncoder;
import works.xmlcodec.exceptions.InvalidStructureException;

/**
 * Builds XML from JSON. A JSON object is read the same way as the nested maps an
 * {@link XmlEncoder} accepts: members become elements, arrays become repeated siblings,
 * and the {@code "@attributes"} and {@code "@value"} members work as usual.
 * Decimals are kept as written.
 */
public final class JsonStructures {
	private final ObjectMapper mapper;
	private final XmlEncoder encoder;

	public JsonStructures() {
		this(JsonMapper.builder()
			.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
			.build(),
			new DefaultXmlEncoder());
	}

	public JsonStructures(ObjectMapper mapper, XmlEncoder encoder) {
		this.mapper = mapper;
		this.encoder = encoder;
	}

	/**
	 * @throws InvalidStructureException if {@code json} is not an object.
	 */
	public Map<String, Object> toStructure(JsonNode json) {
		if (!json.isObject()) {
			throw new InvalidStructureException("Only a JSON object can describe an XML document, not " + json.getNodeType());
		}
		return mapper.convertValue(json, STRUCTURE);
	}

	public Map<String, Object> toStructure(String json) {
		return toStructure(mapper.readTree(json));
	}

	public XmlDocument encode(JsonNode json) {
		return encode(json, null);
	}

	public XmlDocument encode(JsonNode json, @Nullable Namespace namespace) {
		Map<String, Object> structure = toStructure(json);
		LOGGER.debug("Encoding JSON object with {} top-level members", structure.size());
		return encoder.encode(structure, namespace);
	}

	public XmlDocument encode(String json) {
		return encode(mapper.readTree(json), null);
	}

	private static final TypeReference<Map<String, Object>> STRUCTURE = new TypeReference<Map<String, Object>>() { };
	private static final Logger LOGGER = LoggerFactory.getLogger(JsonStructures.class);
}
