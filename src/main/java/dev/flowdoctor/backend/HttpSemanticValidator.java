package dev.flowdoctor.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowdoctor.model.NodeIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic validator reached over HTTP. Posts {@code {csv, botId, token}} and reads
 * {@code {valid, errors, versionId}}; a 401 or an {@code authError} flag is an authentication failure.
 */
public final class HttpSemanticValidator implements SemanticValidator {

    static final String SERVICE = "semantic validator";

    private static final Logger log = LoggerFactory.getLogger(HttpSemanticValidator.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RestTemplate restTemplate;
    private final String url;

    public HttpSemanticValidator(RestTemplate restTemplate, String url) {
        this.restTemplate = restTemplate;
        this.url = url;
    }

    @Override
    public ValidationResponse validate(String csv, Credentials credentials) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("csv", csv);
        body.put("botId", credentials.botId());
        body.put("token", credentials.token());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        log.debug("POST {} ({} chars)", url, csv.length());
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new AuthenticationException(SERVICE, "API token is invalid or expired", e);
        } catch (HttpStatusCodeException e) {
            throw new ExternalServiceException(SERVICE, e.getStatusCode().value(),
                "HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, null, e.getMessage(), e);
        }
        return parse(response.getBody());
    }

    static ValidationResponse parse(String body) {
        JsonNode root;
        try {
            root = body == null ? null : MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(SERVICE, null, "unreadable response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ExternalServiceException(SERVICE, "response is not a JSON object");
        }
        if (root.path("authError").asBoolean(false)) {
            String reason = root.path("errors").isTextual() ? root.get("errors").asText() : "API token is invalid or expired";
            throw new AuthenticationException(SERVICE, reason, null);
        }
        if (root.path("valid").asBoolean(false)) {
            JsonNode versionId = root.get("versionId");
            return ValidationResponse.accepted(versionId == null || versionId.isNull() ? null : versionId.asText());
        }
        return ValidationResponse.rejected(parseErrors(root.path("errors")));
    }

    /**
     * Accepts both {@code {node_num, err_msgs: [{field_name, error_description, field_entry}]}} and
     * the flat {@code {nodeId, field, message, fieldEntry}} form.
     */
    static List<ExternalError> parseErrors(JsonNode errors) {
        var out = new ArrayList<ExternalError>();
        if (errors.isTextual()) {
            out.add(ExternalError.of(null, "", errors.asText()));
            return out;
        }
        for (JsonNode error : errors) {
            Integer nodeId = nodeId(error.has("node_num") ? error.get("node_num") : error.get("nodeId"));
            JsonNode messages = error.path("err_msgs");
            if (messages.isArray() && !messages.isEmpty()) {
                for (JsonNode message : messages) {
                    out.add(new ExternalError(nodeId,
                        text(message, "field_name", "field"),
                        text(message, "error_description", "message"),
                        text(message, "field_entry", "fieldEntry")));
                }
            } else {
                out.add(new ExternalError(nodeId,
                    text(error, "field_name", "field"),
                    text(error, "error_description", "message"),
                    text(error, "field_entry", "fieldEntry")));
            }
        }
        return out;
    }

    private static Integer nodeId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        var parsed = NodeIds.parse(node.asText());
        return parsed.isPresent() ? parsed.getAsInt() : null;
    }

    private static String text(JsonNode node, String name, String alternative) {
        JsonNode value = node.has(name) ? node.get(name) : node.get(alternative);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
