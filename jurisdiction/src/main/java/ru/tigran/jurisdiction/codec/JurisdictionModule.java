package ru.tigran.jurisdiction.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import ru.tigran.jurisdiction.IntermediateRegion;
import ru.tigran.jurisdiction.Jurisdiction;
import ru.tigran.jurisdiction.Region;
import ru.tigran.jurisdiction.SubRegion;
import ru.tigran.jurisdiction.exception.ErrorCode;

import java.io.IOException;
import java.util.function.Function;

/**
 * Jackson module for carrying jurisdictions across an API boundary.
 *
 * - {@link Jurisdiction} is written as its alpha-2 code and read from an alpha-2 or alpha-3 code
 * - {@link Region}, {@link SubRegion} and {@link IntermediateRegion} are written as their published
 *   names and read back through {@code fromLabel}, so unknown names become UNDEFINED
 *
 * Usage:
 * ObjectMapper mapper = new ObjectMapper().registerModule(new JurisdictionModule());
 */
public class JurisdictionModule extends SimpleModule {

    public JurisdictionModule() {
        super("JurisdictionModule");
        addSerializer(Jurisdiction.class, new JurisdictionSerializer());
        addDeserializer(Jurisdiction.class, new JurisdictionDeserializer());

        addSerializer(Region.class, new LabelSerializer<Region>(Region.class, Region::getLabel));
        addDeserializer(Region.class, new LabelDeserializer<Region>(Region.class, Region::fromLabel));
        addSerializer(SubRegion.class, new LabelSerializer<SubRegion>(SubRegion.class, SubRegion::getLabel));
        addDeserializer(SubRegion.class, new LabelDeserializer<SubRegion>(SubRegion.class, SubRegion::fromLabel));
        addSerializer(IntermediateRegion.class,
                new LabelSerializer<IntermediateRegion>(IntermediateRegion.class, IntermediateRegion::getLabel));
        addDeserializer(IntermediateRegion.class,
                new LabelDeserializer<IntermediateRegion>(IntermediateRegion.class, IntermediateRegion::fromLabel));
    }

    static class JurisdictionSerializer extends StdSerializer<Jurisdiction> {

        JurisdictionSerializer() {
            super(Jurisdiction.class);
        }

        @Override
        public void serialize(Jurisdiction value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(AlphaCodec.format(value.getAlpha2()));
        }
    }

    static class JurisdictionDeserializer extends StdDeserializer<Jurisdiction> {

        JurisdictionDeserializer() {
            super(Jurisdiction.class);
        }

        @Override
        public Jurisdiction deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                return (Jurisdiction) ctxt.handleUnexpectedToken(Jurisdiction.class, p);
            }
            String text = p.getText();
            return AlphaCodec.parse(text).orElseThrow(() -> InvalidFormatException.from(p,
                    ErrorCode.UNRECOGNIZED_CODE.getDefaultMessage() + ": " + text, text, Jurisdiction.class));
        }
    }

    static class LabelSerializer<T> extends StdSerializer<T> {
        private final Function<T, String> label;

        LabelSerializer(Class<T> type, Function<T, String> label) {
            super(type);
            this.label = label;
        }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(label.apply(value));
        }
    }

    static class LabelDeserializer<T> extends StdDeserializer<T> {
        private final Class<T> type;
        private final Function<String, T> fromLabel;

        LabelDeserializer(Class<T> type, Function<String, T> fromLabel) {
            super(type);
            this.type = type;
            this.fromLabel = fromLabel;
        }

        @Override
        public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (!p.hasToken(JsonToken.VALUE_STRING)) {
                return type.cast(ctxt.handleUnexpectedToken(type, p));
            }
            return fromLabel.apply(p.getText());
        }
    }
}
