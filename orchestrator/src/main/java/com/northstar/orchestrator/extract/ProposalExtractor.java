package com.northstar.orchestrator.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.northstar.orchestrator.extract.ExtractionException.Kind;
import com.northstar.orchestrator.extract.ProposalFields.Impact;
import com.northstar.orchestrator.extract.ProposalFields.PlanStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a proposal object from free-form language model output.
 *
 * The model is asked for a JSON object but may wrap it in prose or a code
 * fence, leave raw source code unescaped inside "update_block", or refuse
 * outright. The pipeline, in order:
 *
 *   1. refusal detection      (short-circuits everything else)
 *   2. code fence stripping
 *   3. brace-matched scan     (JsonObjectScanner)
 *   4. fallback regexes       (non-greedy balanced, then greedy)
 *   5. parse, re-escape update_block, sanitise control chars
 *   6. field normalisation
 *   7. patch header removal from update_block
 *
 * Nothing here retries; every failure is an {@link ExtractionException}.
 */
@Component
public class ProposalExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProposalExtractor.class);

    static final int    MIN_RESPONSE_LENGTH = 20;
    static final double DEFAULT_CONFIDENCE  = 0.5;

    private static final List<String> REFUSAL_PHRASES = List.of(
            "i can't assist", "i cannot assist",
            "i can't help",   "i cannot help",
            "i'm sorry",      "i am sorry",
            "i'm not able to", "i am not able to",
            "unable to",
            "as an ai");

    private static final List<String> RECOGNISED_KEYS = List.of(
            "\"idea_summary\"", "\"proposal_id\"", "\"update_block\"",
            "\"technical_plan\"", "\"rationale\"");

    // ```json, ```JSON, ``` ... up to the end of the fence line
    private static final Pattern OPENING_FENCE = Pattern.compile("^```[\\w-]*[ \\t]*\\r?\\n?");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\r?\\n?```\\s*$");

    // One level of nesting is enough for expected_impact / technical_plan entries.
    private static final Pattern BALANCED_OBJECT =
            Pattern.compile("\\{(?:[^{}]|\\{[^{}]*\\})*?\\}", Pattern.DOTALL);
    private static final Pattern GREEDY_OBJECT =
            Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private static final Pattern UPDATE_BLOCK_VALUE_START =
            Pattern.compile("\"update_block\"\\s*:\\s*\"");
    // The closing quote of a string value: followed by the next key, or by the final brace.
    private static final Pattern STRING_VALUE_END =
            Pattern.compile("\"\\s*(?:,\\s*\"[A-Za-z_][A-Za-z0-9_]*\"\\s*:|}\\s*$)");

    private static final Pattern PATCH_HEADER = Pattern.compile(
            "^(?:diff --git .*|index [0-9a-fA-F]+\\.\\.[0-9a-fA-F]+.*|(?:---|\\+\\+\\+) \\S.*|@@ .* @@.*)$");

    private final ObjectMapper json;

    public ProposalExtractor(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /**
     * Extract a validated proposal from raw model text.
     *
     * @throws ExtractionException REFUSED_BY_MODEL, NO_JSON_FOUND or UNREPAIRABLE_JSON
     */
    public ProposalFields extract(String rawText) {
        String raw = rawText == null ? "" : rawText;

        if (isRefusal(raw)) {
            log.info("Model output classified as refusal ({} chars)", raw.length());
            throw new ExtractionException(Kind.REFUSED_BY_MODEL,
                    "Model declined to produce a proposal", raw);
        }

        String text = stripFence(raw.strip());

        Set<String> candidates = candidates(text);
        if (candidates.isEmpty()) {
            throw new ExtractionException(Kind.NO_JSON_FOUND,
                    "No JSON object found in model output", raw);
        }

        JsonNode node = parseWithRepair(candidates, raw);
        if (!node.has("idea_summary") && !node.has("proposal_id")) {
            throw new ExtractionException(Kind.NO_JSON_FOUND,
                    "JSON object has neither idea_summary nor proposal_id", raw);
        }
        return normalise(node);
    }

    /** Canonical JSON for a proposal; {@link #extract} reads it back unchanged. */
    public String serialize(ProposalFields fields) {
        try {
            return json.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise proposal", e);
        }
    }

    // ------------------------------------------------------------------
    // Step 1: refusal
    // ------------------------------------------------------------------

    static boolean isRefusal(String raw) {
        String trimmed = raw.strip();
        if (startsWithJson(trimmed)) return false;
        if (trimmed.length() < MIN_RESPONSE_LENGTH) return true;

        String lower = trimmed.toLowerCase(Locale.ROOT).replace('’', '\'');
        return REFUSAL_PHRASES.stream().anyMatch(lower::contains);
    }

    private static boolean startsWithJson(String trimmed) {
        if (trimmed.startsWith("{")) return true;
        if (!trimmed.startsWith("```")) return false;
        Matcher m = OPENING_FENCE.matcher(trimmed);
        return m.find() && trimmed.substring(m.end()).stripLeading().startsWith("{");
    }

    // ------------------------------------------------------------------
    // Steps 2-4: locating candidate objects
    // ------------------------------------------------------------------

    static String stripFence(String text) {
        if (!text.startsWith("```")) return text;
        String body = OPENING_FENCE.matcher(text).replaceFirst("");
        return CLOSING_FENCE.matcher(body).replaceFirst("").strip();
    }

    /** Ordered, de-duplicated candidates: brace scan first, then the regex fallbacks. */
    private Set<String> candidates(String text) {
        Set<String> out = new LinkedHashSet<>();
        JsonObjectScanner.firstObject(text).ifPresent(out::add);

        Matcher balanced = BALANCED_OBJECT.matcher(text);
        while (balanced.find()) {
            if (hasRecognisedKey(balanced.group())) {
                out.add(balanced.group());
                break;
            }
        }
        Matcher greedy = GREEDY_OBJECT.matcher(text);
        if (greedy.find() && hasRecognisedKey(greedy.group())) {
            out.add(greedy.group());
        }
        return out;
    }

    private static boolean hasRecognisedKey(String candidate) {
        return RECOGNISED_KEYS.stream().anyMatch(candidate::contains);
    }

    // ------------------------------------------------------------------
    // Step 5: parse and repair
    // ------------------------------------------------------------------

    private JsonNode parseWithRepair(Set<String> candidates, String raw) {
        String lastError = "unknown";

        for (String candidate : candidates) {
            Optional<JsonNode> parsed = tryParse(candidate);
            if (parsed.isPresent()) return parsed.get();
        }

        // Least invasive first: an update_block that is already escaped must
        // not be re-escaped because some other field broke the parse.
        for (String candidate : candidates) {
            try {
                return parseObject(JsonObjectScanner.sanitizeControlCharacters(candidate));
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
            }

            Optional<String> repaired = reescapeUpdateBlock(candidate);
            if (repaired.isEmpty()) continue;
            Optional<JsonNode> parsed = tryParse(repaired.get());
            if (parsed.isPresent()) {
                log.debug("Recovered proposal JSON by re-escaping update_block");
                return parsed.get();
            }
            try {
                return parseObject(JsonObjectScanner.sanitizeControlCharacters(repaired.get()));
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
            }
        }

        log.warn("Could not repair proposal JSON: {}", lastError);
        throw new ExtractionException(Kind.UNREPAIRABLE_JSON,
                "Could not parse proposal JSON: " + lastError, raw);
    }

    private Optional<JsonNode> tryParse(String candidate) {
        try {
            return Optional.of(parseObject(candidate));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private JsonNode parseObject(String candidate) throws JsonProcessingException {
        JsonNode node = json.readTree(candidate);
        if (node == null || !node.isObject()) {
            throw new JsonMappingException((Closeable) null, "Top-level value is not an object");
        }
        return node;
    }

    /**
     * Re-escape the raw value of "update_block" in place.
     *
     * The value is taken to run from the opening quote to the first quote that
     * is followed by another key or by the closing brace, so unescaped quotes
     * and newlines in between are treated as content.
     */
    static Optional<String> reescapeUpdateBlock(String candidate) {
        Matcher start = UPDATE_BLOCK_VALUE_START.matcher(candidate);
        if (!start.find()) return Optional.empty();
        int valueStart = start.end();

        Matcher end = STRING_VALUE_END.matcher(candidate);
        if (!end.find(valueStart)) return Optional.empty();

        String rawValue = candidate.substring(valueStart, end.start());
        return Optional.of(candidate.substring(0, valueStart)
                + escapeJsonString(rawValue)
                + candidate.substring(end.start()));
    }

    static String escapeJsonString(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 16);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"'  -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default   -> sb.append(c);
            }
        }
        return sb.toString();
    }

    // ------------------------------------------------------------------
    // Steps 6-7: normalisation
    // ------------------------------------------------------------------

    private ProposalFields normalise(JsonNode node) {
        return new ProposalFields(
                text(node, "proposal_id"),
                text(node, "idea_summary"),
                text(node, "rationale"),
                text(node, "category"),
                impact(node.get("expected_impact")),
                plan(node.get("technical_plan")),
                stripPatchHeaders(updateBlock(node.get("update_block"))),
                clamp(number(node.get("confidence"), DEFAULT_CONFIDENCE)));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        return v.isValueNode() ? v.asText() : v.toString();
    }

    private static String updateBlock(JsonNode v) {
        if (v == null || v.isNull()) return "";
        if (v.isArray()) {
            List<String> lines = new ArrayList<>();
            v.forEach(line -> lines.add(line.isNull() ? "" : line.asText()));
            return String.join("\n", lines);
        }
        return v.asText();
    }

    private static Impact impact(JsonNode v) {
        if (v == null || !v.isObject()) return null;
        return new Impact(text(v, "metric"), number(v.get("delta_pct"), 0.0));
    }

    private static List<PlanStep> plan(JsonNode v) {
        if (v == null || !v.isArray()) return List.of();
        List<PlanStep> steps = new ArrayList<>();
        for (JsonNode entry : v) {
            if (entry.isObject()) {
                steps.add(new PlanStep(text(entry, "file"), text(entry, "action")));
            } else if (entry.isTextual()) {
                steps.add(new PlanStep(null, entry.asText()));
            }
        }
        return steps;
    }

    private static double number(JsonNode v, double fallback) {
        if (v == null || v.isNull()) return fallback;
        if (v.isNumber()) return v.asDouble();
        if (v.isTextual()) {
            try {
                return Double.parseDouble(v.asText().strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) return DEFAULT_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    /** The pipeline consumes a Fast-Apply block, so unified diff headers are noise. */
    static String stripPatchHeaders(String updateBlock) {
        if (updateBlock.isEmpty()) return updateBlock;
        String[] lines = updateBlock.split("\n", -1);
        List<String> kept = new ArrayList<>(lines.length);
        for (String line : lines) {
            String bare = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            if (!PATCH_HEADER.matcher(bare).matches()) kept.add(line);
        }
        return kept.size() == lines.length ? updateBlock : String.join("\n", kept);
    }
}
