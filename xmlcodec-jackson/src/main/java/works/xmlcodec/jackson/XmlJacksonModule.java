package works.xmlcodec.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.Version;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.ser.Serializers;
import works.xmlcodec.XmlDocument;

/**
 * Lets Jackson write an {@link XmlDocument} as the nested objects, arrays and
 * strings of its {@link XmlDocument#toArray() projection}.
 */
public final class XmlJacksonModule extends JacksonModule {

	@Override
	public String getModuleName() {
		return getClass().getSimpleName();
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(new XmlSerializers());
	}

	private static final class XmlSerializers extends Serializers.Base {
		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			if (XmlDocument.class.isAssignableFrom(type.getRawClass())) {
				return DOCUMENT_SERIALIZER;
			}
			return null;
		}
	}

	private static final ValueSerializer<XmlDocument> DOCUMENT_SERIALIZER = new ValueSerializer<>() {
		@Override
		public void serialize(XmlDocument value, JsonGenerator gen, SerializationContext serializers) {
			gen.writePOJO(value.toArray());
		}
	};
}
