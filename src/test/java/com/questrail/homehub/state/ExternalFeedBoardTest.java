package com.questrail.homehub.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.homehub.message.ViewerMessageType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExternalFeedBoardTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExternalFeedBoard board = new ExternalFeedBoard();

    @Test
    void firstPayloadIsAChange() {
        assertTrue(board.update(ViewerMessageType.WEATHER, weather(12.0)));
        assertEquals(12.0, board.latest(ViewerMessageType.WEATHER).orElseThrow().get("temp").asDouble());
    }

    @Test
    void identicalPayloadIsNotAChange() {
        board.update(ViewerMessageType.WEATHER, weather(12.0));
        assertFalse(board.update(ViewerMessageType.WEATHER, weather(12.0)));
        assertTrue(board.update(ViewerMessageType.WEATHER, weather(12.5)));
    }

    @Test
    void storedPayloadIsIsolatedFromCallerMutation() {
        ObjectNode payload = weather(12.0);
        board.update(ViewerMessageType.WEATHER, payload);
        payload.put("temp", 99.0);

        assertEquals(12.0, board.snapshot().get(ViewerMessageType.WEATHER).get("temp").asDouble());
        assertTrue(board.update(ViewerMessageType.WEATHER, payload));
    }

    @Test
    void feedsAreIndependent() {
        board.update(ViewerMessageType.WEATHER, weather(1));
        assertTrue(board.update(ViewerMessageType.NAMEDAY, mapper.createObjectNode().put("name", "Bedřich")));
        assertEquals(2, board.snapshot().size());
        assertTrue(board.latest(ViewerMessageType.CALENDAR).isEmpty());
    }

    @Test
    void rejectsNonFeedTypes() {
        assertThrows(IllegalArgumentException.class, () -> board.update(ViewerMessageType.SENSORS, weather(1)));
        assertThrows(IllegalArgumentException.class, () -> board.latest(ViewerMessageType.HEARTBEAT));
    }

    private ObjectNode weather(double temp) {
        return mapper.createObjectNode().put("temp", temp).put("icon", "cloudy");
    }
}
