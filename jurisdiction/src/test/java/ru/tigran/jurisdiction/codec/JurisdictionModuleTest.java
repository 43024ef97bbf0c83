package ru.tigran.jurisdiction.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.jurisdiction.Alpha2;
import ru.tigran.jurisdiction.IntermediateRegion;
import ru.tigran.jurisdiction.Jurisdiction;
import ru.tigran.jurisdiction.Region;
import ru.tigran.jurisdiction.SubRegion;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JurisdictionModule tests")
class JurisdictionModuleTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JurisdictionModule());
    }

    @Test
    @DisplayName("serialize - jurisdiction is written as its alpha-2 code")
    void serializeJurisdiction() throws Exception {
        assertEquals("\"NO\"", objectMapper.writeValueAsString(Jurisdiction.fromString("NOR")));
        assertEquals("{\"home\":\"GG\"}", objectMapper.writeValueAsString(Map.of("home", Jurisdiction.of(Alpha2.GG))));
    }

    @Test
    @DisplayName("deserialize - alpha-2 and alpha-3 codes are accepted")
    void deserializeJurisdiction() throws Exception {
        List<Jurisdiction> parsed = objectMapper.readValue("[\"NO\", \"NOR\", \"SE\"]", new TypeReference<List<Jurisdiction>>() {});

        assertEquals(List.of(Jurisdiction.of(Alpha2.NO), Jurisdiction.of(Alpha2.NO), Jurisdiction.of(Alpha2.SE)), parsed);
    }

    @Test
    @DisplayName("deserialize - unknown code fails with InvalidFormatException")
    void deserializeUnknownCode() {
        InvalidFormatException exception = assertThrows(InvalidFormatException.class,
                () -> objectMapper.readValue("\"XX\"", Jurisdiction.class));

        assertEquals("XX", exception.getValue());
        assertEquals(Jurisdiction.class, exception.getTargetType());
    }

    @Test
    @DisplayName("deserialize - non-string token is rejected")
    void deserializeNumber() {
        assertThrows(MismatchedInputException.class, () -> objectMapper.readValue("578", Jurisdiction.class));
    }

    @Test
    @DisplayName("regions - written as published names, unknown names read as UNDEFINED")
    void regionLabels() throws Exception {
        assertEquals("\"Northern Europe\"", objectMapper.writeValueAsString(SubRegion.NORTHERN_EUROPE));
        assertEquals("\"\"", objectMapper.writeValueAsString(Region.UNDEFINED));
        assertEquals(Region.EUROPE, objectMapper.readValue("\"Europe\"", Region.class));
        assertEquals(IntermediateRegion.CHANNEL_ISLANDS, objectMapper.readValue("\"Channel Islands\"", IntermediateRegion.class));
        assertEquals(Region.UNDEFINED, objectMapper.readValue("\"Atlantis\"", Region.class));
    }
}
