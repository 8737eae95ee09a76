package com.ipd.parser;

import static com.ipd.TestPlayers.moves;
import static com.ipd.TestPlayers.play;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonParser;
import com.ipd.model.PlayerType;
import com.ipd.strategy.BasicStrategies;
import com.ipd.transformer.Transformer;
import com.ipd.transformer.Transformers;
import org.junit.jupiter.api.Test;

class TransformerParserTest {

    private static PlayerType applyTo(Transformer transformer, PlayerType base) {
        return transformer.apply(base);
    }

    @Test
    void parsesSimpleDescriptors() {
        assertSame(Transformers.flip(), TransformerParser.parse("flip"));
        assertSame(Transformers.trackHistory(), TransformerParser.parse("track"));
        assertEquals("RUA", TransformerParser.parse("rua").namePrefix());
        assertEquals("Noisy", TransformerParser.parse("noisy : 0.25").namePrefix());
        assertEquals("Forgiving", TransformerParser.parse("FORGIVER:1").namePrefix());
    }

    @Test
    void parsesSequences() {
        PlayerType initial = applyTo(TransformerParser.parse("initial:dcd"), BasicStrategies.COOPERATOR);
        assertEquals(moves("DCDCC"), play(initial, BasicStrategies.COOPERATOR, 5));

        PlayerType defaultFinal = applyTo(TransformerParser.parse("final"), BasicStrategies.COOPERATOR);
        assertEquals(moves("CDDD"), play(defaultFinal, BasicStrategies.COOPERATOR, 4));
    }

    @Test
    void parsesJsonDescriptors() {
        Transformer forgiving = TransformerParser.parse(
            JsonParser.parseString("{\"type\": \"forgiver\", \"p\": 1.0, \"prefix\": \"Kind\"}"));
        PlayerType kind = forgiving.apply(BasicStrategies.DEFECTOR);
        assertEquals("Kind Defector", kind.name());
        assertEquals(moves("CCC"), play(kind, BasicStrategies.DEFECTOR, 3));

        Transformer initial = TransformerParser.parse(
            JsonParser.parseString("{\"type\": \"initial\", \"sequence\": \"CC\"}"));
        assertEquals(moves("CCD"), play(initial.apply(BasicStrategies.DEFECTOR), BasicStrategies.DEFECTOR, 3));

        assertSame(Transformers.flip(), TransformerParser.parse(JsonParser.parseString("\"flip\"")));
    }

    @Test
    void rejectsMalformedDescriptors() {
        assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse("shuffle"));
        assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse("noisy"));
        assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse("noisy:lots"));
        assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse("noisy:2"));
        assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse("flip:1"));
        assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse("initial:CXD"));
        assertThrows(IllegalArgumentException.class,
            () -> TransformerParser.parse(JsonParser.parseString("{\"noise\": 0.1}")));
        assertThrows(IllegalArgumentException.class,
            () -> TransformerParser.parse(JsonParser.parseString("[1, 2]")));
    }

    @Test
    void acceptsOnlyTheArgumentOfTheGivenType() {
        var forgiver = assertThrows(IllegalArgumentException.class,
            () -> TransformerParser.parse(JsonParser.parseString("{\"type\": \"forgiver\", \"noise\": 0.3}")));
        assertTrue(forgiver.getMessage().contains("noise"));

        var noisy = assertThrows(IllegalArgumentException.class, () -> TransformerParser.parse(
            JsonParser.parseString("{\"type\": \"noisy\", \"noise\": 0.1, \"sequence\": \"DD\"}")));
        assertTrue(noisy.getMessage().contains("sequence"));

        assertThrows(IllegalArgumentException.class,
            () -> TransformerParser.parse(JsonParser.parseString("{\"type\": \"flip\", \"p\": 1}")));
        assertThrows(IllegalArgumentException.class,
            () -> TransformerParser.parse(JsonParser.parseString("{\"type\": \"noisy\", \"noise\": [0.1]}")));
        assertThrows(IllegalArgumentException.class,
            () -> TransformerParser.parse(JsonParser.parseString("{\"type\": 1}")));
    }

    @Test
    void readsNumericAndTextualProbabilities() {
        PlayerType forgiving = TransformerParser.parse(
            JsonParser.parseString("{\"type\": \"forgiving\", \"p\": \"1\"}")).apply(BasicStrategies.DEFECTOR);
        assertEquals(moves("CC"), play(forgiving, BasicStrategies.DEFECTOR, 2));

        PlayerType noisy = TransformerParser.parse(
            JsonParser.parseString("{\"type\": \"noisy\", \"noise\": 1}")).apply(BasicStrategies.DEFECTOR);
        assertEquals(moves("CC"), play(noisy, BasicStrategies.DEFECTOR, 2));
    }
}
