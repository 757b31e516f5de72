package org.battlebots.ipc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.battlebots.runtime.config.SimulationConfig;
import org.battlebots.runtime.model.BotState;
import org.battlebots.runtime.model.Vector2;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Line-oriented JSON codec for the bot protocol.
 * <p>
 * Field names are snake_case. An outbound line is a two element array {@code [state, message]}
 * where the message is externally tagged ({@code {"Step":{"elapsed":0.08}}}, or the bare string
 * {@code "Kill"}). An inbound line is an array of single-entry objects such as
 * {@code {"SetThrust":2.5}}.
 * <p>
 * Instances are immutable and thread-safe.
 */
public class WireCodec {

    private static final String INIT = "Init";
    private static final String STEP = "Step";
    private static final String SCAN = "Scan";
    private static final String KILL = "Kill";

    private static final String SET_THRUST = "SetThrust";
    private static final String SET_TURN_RATE = "SetTurnRate";
    private static final String SET_GUN_TURN_RATE = "SetGunTurnRate";
    private static final String SET_RADAR_TURN_RATE = "SetRadarTurnRate";
    private static final String SHOOT = "Shoot";
    private static final String DEBUG_PRINT = "DebugPrint";

    private final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .create();

    /**
     * Encodes an envelope as a single line (without the trailing newline).
     *
     * @param envelope the envelope to encode.
     * @return the JSON text.
     * @throws WireFormatException if the envelope contains values JSON cannot represent (NaN, infinity).
     */
    public String encodeEnvelope(Envelope envelope) throws WireFormatException {
        try {
            JsonArray pair = new JsonArray();
            pair.add(gson.toJsonTree(envelope.state()));
            pair.add(encodeMessage(envelope.message()));
            return gson.toJson(pair);
        } catch (IllegalArgumentException e) {
            throw new WireFormatException("Cannot encode envelope: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes one outbound line.
     *
     * @param line the JSON text.
     * @return the decoded envelope.
     * @throws WireFormatException if the line is not a valid envelope.
     */
    public Envelope decodeEnvelope(String line) throws WireFormatException {
        JsonElement root = parse(line);
        if (!root.isJsonArray() || root.getAsJsonArray().size() != 2) {
            throw new WireFormatException("Expected [state, message] but got: " + abbreviate(line));
        }
        JsonArray pair = root.getAsJsonArray();
        if (!pair.get(0).isJsonObject()) {
            throw new WireFormatException("Bot state must be an object");
        }

        BotState state = fromTree(pair.get(0), BotState.class);
        if (state.getPos() == null) {
            throw new WireFormatException("Bot state has no position");
        }
        return new Envelope(state, decodeMessage(pair.get(1)));
    }

    /**
     * Encodes a response list as a single line.
     *
     * @param responses the responses, in order.
     * @return the JSON text.
     * @throws WireFormatException if a value cannot be represented in JSON.
     */
    public String encodeResponses(List<Response> responses) throws WireFormatException {
        JsonArray array = new JsonArray();
        for (Response response : responses) {
            JsonObject tagged = new JsonObject();
            if (response instanceof Response.SetThrust r) {
                tagged.addProperty(SET_THRUST, finite(SET_THRUST, r.value()));
            } else if (response instanceof Response.SetTurnRate r) {
                tagged.addProperty(SET_TURN_RATE, finite(SET_TURN_RATE, r.value()));
            } else if (response instanceof Response.SetGunTurnRate r) {
                tagged.addProperty(SET_GUN_TURN_RATE, finite(SET_GUN_TURN_RATE, r.value()));
            } else if (response instanceof Response.SetRadarTurnRate r) {
                tagged.addProperty(SET_RADAR_TURN_RATE, finite(SET_RADAR_TURN_RATE, r.value()));
            } else if (response instanceof Response.Shoot r) {
                tagged.addProperty(SHOOT, finite(SHOOT, r.power()));
            } else if (response instanceof Response.DebugPrint r) {
                tagged.addProperty(DEBUG_PRINT, r.message());
            }
            array.add(tagged);
        }
        return gson.toJson(array);
    }

    /**
     * Decodes one inbound line.
     *
     * @param line the JSON text.
     * @return the responses in the order the bot sent them.
     * @throws WireFormatException if the line is not a response array or contains an unknown tag.
     */
    public List<Response> decodeResponses(String line) throws WireFormatException {
        JsonElement root = parse(line);
        if (!root.isJsonArray()) {
            throw new WireFormatException("Expected a response array but got: " + abbreviate(line));
        }

        List<Response> responses = new ArrayList<>(root.getAsJsonArray().size());
        for (JsonElement element : root.getAsJsonArray()) {
            Map.Entry<String, JsonElement> entry = singleEntry(element);
            JsonElement value = entry.getValue();
            Response response = switch (entry.getKey()) {
                case SET_THRUST -> new Response.SetThrust(number(entry.getKey(), value));
                case SET_TURN_RATE -> new Response.SetTurnRate(number(entry.getKey(), value));
                case SET_GUN_TURN_RATE -> new Response.SetGunTurnRate(number(entry.getKey(), value));
                case SET_RADAR_TURN_RATE -> new Response.SetRadarTurnRate(number(entry.getKey(), value));
                case SHOOT -> new Response.Shoot(number(entry.getKey(), value));
                case DEBUG_PRINT -> {
                    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
                        throw new WireFormatException("DebugPrint expects a string");
                    }
                    yield new Response.DebugPrint(value.getAsString());
                }
                default -> throw new WireFormatException("Unknown response: " + entry.getKey());
            };
            responses.add(response);
        }
        return responses;
    }

    private JsonElement encodeMessage(Message message) throws WireFormatException {
        if (message instanceof Message.Kill) {
            return new JsonPrimitive(KILL);
        }

        JsonObject body = new JsonObject();
        String tag;
        if (message instanceof Message.Init init) {
            tag = INIT;
            body.add("config", gson.toJsonTree(init.config()));
        } else if (message instanceof Message.Step step) {
            tag = STEP;
            body.addProperty("elapsed", finite(STEP, step.elapsed()));
        } else if (message instanceof Message.Scan scan) {
            tag = SCAN;
            body.add("scan_pos", gson.toJsonTree(scan.scanPos()));
        } else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }

        JsonObject tagged = new JsonObject();
        tagged.add(tag, body);
        return tagged;
    }

    private Message decodeMessage(JsonElement element) throws WireFormatException {
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            if (KILL.equals(element.getAsString())) {
                return new Message.Kill();
            }
            throw new WireFormatException("Unknown message: " + element.getAsString());
        }

        Map.Entry<String, JsonElement> entry = singleEntry(element);
        if (!entry.getValue().isJsonObject()) {
            throw new WireFormatException(entry.getKey() + " expects an object body");
        }
        JsonObject body = entry.getValue().getAsJsonObject();
        return switch (entry.getKey()) {
            case INIT -> new Message.Init(fromTree(required(body, INIT, "config"), SimulationConfig.class));
            case STEP -> new Message.Step(number(STEP, required(body, STEP, "elapsed")));
            case SCAN -> new Message.Scan(fromTree(required(body, SCAN, "scan_pos"), Vector2.class));
            case KILL -> new Message.Kill();
            default -> throw new WireFormatException("Unknown message: " + entry.getKey());
        };
    }

    private <T> T fromTree(JsonElement element, Class<T> type) throws WireFormatException {
        try {
            T value = gson.fromJson(element, type);
            if (value == null) {
                throw new WireFormatException("Missing " + type.getSimpleName());
            }
            return value;
        } catch (RuntimeException e) {
            // Gson reports both malformed input and rejected record constructors as runtime exceptions.
            throw new WireFormatException("Invalid " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static JsonElement parse(String line) throws WireFormatException {
        if (line == null || line.isBlank()) {
            throw new WireFormatException("Empty line");
        }
        try {
            return JsonParser.parseString(line);
        } catch (RuntimeException e) {
            throw new WireFormatException("Malformed JSON: " + abbreviate(line), e);
        }
    }

    private static Map.Entry<String, JsonElement> singleEntry(JsonElement element) throws WireFormatException {
        if (!element.isJsonObject() || element.getAsJsonObject().size() != 1) {
            throw new WireFormatException("Expected a single-entry tagged object but got: " + element);
        }
        return element.getAsJsonObject().entrySet().iterator().next();
    }

    private static JsonElement required(JsonObject body, String tag, String field) throws WireFormatException {
        JsonElement value = body.get(field);
        if (value == null || value.isJsonNull()) {
            throw new WireFormatException(tag + " is missing '" + field + "'");
        }
        return value;
    }

    private static double number(String tag, JsonElement value) throws WireFormatException {
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new WireFormatException(tag + " expects a number but got: " + value);
        }
        return value.getAsDouble();
    }

    // Gson writes trees leniently, so non-finite numbers must be rejected before they are added.
    private static double finite(String tag, double value) throws WireFormatException {
        if (!Double.isFinite(value)) {
            throw new WireFormatException(tag + " value is not a finite number: " + value);
        }
        return value;
    }

    private static String abbreviate(String line) {
        return line.length() <= 120 ? line : line.substring(0, 117) + "...";
    }
}
