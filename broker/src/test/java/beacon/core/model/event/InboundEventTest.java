package beacon.core.model.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("InboundEvent")
class InboundEventTest {

    @Nested
    @DisplayName("decode")
    class DecodeTests {

        @Test
        @DisplayName("should decode event name and data")
        void shouldDecodeEventNameAndData() {
            var event = InboundEvent.decode("{\"event\":\"join_room\",\"data\":{\"roomId\":\"room:lobby\"}}");

            assertEquals("join_room", event.name());
            assertEquals("room:lobby", event.data().getString("roomId"));
        }

        @Test
        @DisplayName("should default missing data to an empty object")
        void shouldDefaultMissingData() {
            var event = InboundEvent.decode("{\"event\":\"ping\"}");

            assertEquals("ping", event.name());
            assertTrue(event.data().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(
                strings = {
                    "",
                    "   ",
                    "not json",
                    "[1,2,3]",
                    "{\"data\":{}}",
                    "{\"event\":42}",
                    "{\"event\":\"\"}",
                    "{\"event\":\"ping\",\"data\":\"text\"}"
                })
        @DisplayName("should reject malformed frames as INVALID_PAYLOAD")
        void shouldRejectMalformedFrames(String frame) {
            var error = assertThrows(BrokerException.class, () -> InboundEvent.decode(frame));

            assertEquals(BrokerError.INVALID_PAYLOAD, error.getError());
        }
    }

    @Nested
    @DisplayName("field access")
    class FieldAccessTests {

        @Test
        @DisplayName("should reject a blank required field")
        void shouldRejectBlankRequiredField() {
            var event = InboundEvent.decode("{\"event\":\"send_message\",\"data\":{\"message\":\"  \"}}");

            var error = assertThrows(BrokerException.class, () -> event.requireString("message"));
            assertEquals("message is required", error.getMessage());
        }

        @Test
        @DisplayName("should fall back to the default for optional fields")
        void shouldFallBackToDefault() {
            var event = InboundEvent.decode("{\"event\":\"send_message\",\"data\":{}}");

            assertEquals("text", event.optionalString("messageType", "text"));
        }
    }
}
