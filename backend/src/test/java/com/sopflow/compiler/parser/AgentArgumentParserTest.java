package com.sopflow.compiler.parser;

import com.sopflow.compiler.ast.AgentCall;
import com.sopflow.compiler.ast.AgentParameter;
import com.sopflow.compiler.exception.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentArgumentParserTest {

    @Test
    void parse_shouldAcceptNameWithoutArguments() throws StructuralException {
        AgentCall call = AgentArgumentParser.parse("Summarizer", 4);

        assertEquals("Summarizer", call.name());
        assertTrue(call.parameters().isEmpty());
        assertEquals(4, call.line());
    }

    @Test
    void parse_shouldKeepRawValuesAndIgnoreCommasInQuotesAndBrackets() throws StructuralException {
        AgentCall call = AgentArgumentParser.parse(
                "Search(query=\"reset, password\", filters={\"k\": [1, 2]}, limit=5, user={{email}})", 1);

        assertEquals(List.of(
                new AgentParameter("query", "\"reset, password\""),
                new AgentParameter("filters", "{\"k\": [1, 2]}"),
                new AgentParameter("limit", "5"),
                new AgentParameter("user", "{{email}}")
        ), call.parameters());
    }

    @Test
    void parse_shouldKeepEqualsSignsInsideValue() throws StructuralException {
        AgentCall call = AgentArgumentParser.parse("Check(expr=a==b)", 1);

        assertEquals("a==b", call.parameters().get(0).value());
    }

    @Test
    void parse_shouldAcceptEmptyArgumentList() throws StructuralException {
        assertTrue(AgentArgumentParser.parse("Ping()", 1).parameters().isEmpty());
    }

    @Test
    void parse_shouldRejectMalformedArgumentLists() {
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(query)", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(q=\"open)", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(q=1", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(q=1) extra", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(q=1,,r=2)", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(=1)", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search q=1", 1));
        assertThrows(StructuralException.class, () -> AgentArgumentParser.parse("Search(q=[1)", 1));
    }
}
