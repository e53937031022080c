package com.pyast.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.pyast.ast.ExprContext;
import com.pyast.ast.If;
import com.pyast.ast.InternedStringPool;
import com.pyast.ast.Name;
import com.pyast.ast.Pass;
import com.pyast.json.AstJsonProvider;
import com.pyast.json.AstJsonSerializer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());

        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void testUnknownProviderName() {
        assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("Gson"));
    }

    @Test
    void testSerializeAndPrettyAgree() throws Exception {
        InternedStringPool pool = new InternedStringPool();
        If ifStmt = new If(new Name(pool.get("a"), ExprContext.LOAD), List.of(new Pass(0, 0)), List.of());
        JacksonAstJsonProvider provider = new JacksonAstJsonProvider();
        AstJsonSerializer serializer = provider.getSerializer();

        String compact = serializer.serialize(ifStmt);
        String pretty = serializer.serializePretty(ifStmt);

        assertFalse(compact.contains("\n"));
        assertTrue(pretty.contains("\n"));
        JsonNode fromCompact = provider.getObjectMapper().readTree(compact);
        JsonNode fromPretty = provider.getObjectMapper().readTree(pretty);
        assertEquals(fromCompact, fromPretty);
        assertEquals("IF", fromCompact.path("type").asText());
        assertEquals("PASS", fromCompact.path("body").get(0).path("type").asText());
        assertEquals(0, fromCompact.path("orelse").size());
    }
}
