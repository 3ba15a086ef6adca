package com.blockhub.gameservice.platform.transport;

import com.blockhub.gameservice.games.tetris.domain.model.GameConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final WireCodec codec = new WireCodec(mapper);

    @Test
    void decodesCommandIdAndPayload() {
        InboundCommand cmd = codec.decode("create_game:abc-1@{}");

        assertThat(cmd.command()).isEqualTo("create_game");
        assertThat(cmd.commandId()).isEqualTo("abc-1");
        assertThat(cmd.payload()).isEqualTo("{}");
    }

    @Test
    void onlyFirstAtSignSplits() {
        InboundCommand cmd = codec.decode("signup:1@\"me@example\"");

        assertThat(cmd.payload()).isEqualTo("\"me@example\"");
        assertThat(codec.readPayload(cmd, String.class)).isEqualTo("me@example");
    }

    @Test
    void missingPayloadKeepsCommandIdForTheErrorResponse() {
        assertThatThrownBy(() -> codec.decode("create_game:abc"))
                .isInstanceOf(ProtocolParseException.class)
                .extracting("commandId").isEqualTo("abc");
        assertThatThrownBy(() -> codec.decode("create_game:abc@"))
                .isInstanceOf(ProtocolParseException.class)
                .extracting("commandId").isEqualTo("abc");
    }

    @Test
    void frameWithoutIdUsesNilId() {
        assertThatThrownBy(() -> codec.decode("garbage"))
                .isInstanceOf(ProtocolParseException.class)
                .extracting("commandId").isEqualTo(WireCodec.NIL_ID);
        assertThatThrownBy(() -> codec.decode("create_game@{}"))
                .isInstanceOf(ProtocolParseException.class)
                .extracting("commandId").isEqualTo(WireCodec.NIL_ID);
        assertThatThrownBy(() -> codec.decode(":abc@{}"))
                .isInstanceOf(ProtocolParseException.class);
    }

    @Test
    void readsTypedPayload() {
        GameConfig config = codec.readPayload(codec.decode("change_config:1@{\"cols\":6,\"rows\":12,\"name\":\"x\"}"), GameConfig.class);

        assertThat(config.getCols()).isEqualTo(6);
        assertThat(config.getRows()).isEqualTo(12);
        assertThat(config.getName()).isEqualTo("x");
    }

    @Test
    void malformedPayloadIsIllegalArgument() {
        InboundCommand cmd = codec.decode("change_config:1@{not json");

        assertThatThrownBy(() -> codec.readPayload(cmd, GameConfig.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void responseOmitsAbsentFields() throws Exception {
        String ok = codec.encodeResponse("c1", CommandResponse.ok());
        assertThat(ok).isEqualTo("response_c1@{\"status\":\"ok\"}");

        String error = codec.encodeResponse("c2", CommandResponse.error("Game not found"));
        assertThat(error).startsWith("response_c2@");
        JsonNode body = mapper.readTree(error.substring(error.indexOf('@') + 1));
        assertThat(body.get("status").asText()).isEqualTo("error");
        assertThat(body.get("errors").get(0).asText()).isEqualTo("Game not found");
        assertThat(body.has("data")).isFalse();
    }

    @Test
    void eventsCarryJsonPayload() {
        assertThat(codec.encodeEvent("game_not_found", "g1")).isEqualTo("game_not_found@\"g1\"");
        assertThat(codec.encodeEvent("unauthenticated", null)).isEqualTo("unauthenticated@null");
    }
}
