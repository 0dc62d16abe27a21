package dev.flowdoctor.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.stream.Collectors;

/**
 * Generative repairer reached over HTTP. Posts
 * {@code {csv, validationErrors, iteration, knownFixesContext}} and reads {@code {csv, fixesMade, stillBroken}}.
 */
public final class HttpGenerativeRepairer implements GenerativeRepairer {

    static final String SERVICE = "generative repairer";

    private static final Logger log = LoggerFactory.getLogger(HttpGenerativeRepairer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RestTemplate restTemplate;
    private final String url;

    public HttpGenerativeRepairer(RestTemplate restTemplate, String url) {
        this.restTemplate = restTemplate;
        this.url = url;
    }

    @Override
    public RepairProposal propose(String csv, List<ExternalError> errors, int iteration, List<FixHint> hints) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("csv", csv);
        body.put("validationErrors", errors.stream().map(HttpGenerativeRepairer::wireError).toList());
        body.put("iteration", iteration);
        body.put("knownFixesContext", knownFixesContext(hints));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        log.debug("POST {} with {} error(s), {} hint(s)", url, errors.size(), hints.size());
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (HttpClientErrorException.Unauthorized e) {
            throw new AuthenticationException(SERVICE, "credentials rejected", e);
        } catch (HttpStatusCodeException e) {
            throw new ExternalServiceException(SERVICE, e.getStatusCode().value(),
                "HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, null, e.getMessage(), e);
        }
        return parse(response.getBody());
    }

    static RepairProposal parse(String body) {
        JsonNode root;
        try {
            root = body == null ? null : MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(SERVICE, null, "unreadable response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.path("csv").isTextual() || root.get("csv").asText().isBlank()) {
            throw new ExternalServiceException(SERVICE, "response has no csv");
        }
        return new RepairProposal(root.get("csv").asText(), strings(root.path("fixesMade")),
            strings(root.path("stillBroken")));
    }

    /** Hints as prompt text; empty when there are none. */
    static String knownFixesContext(List<FixHint> hints) {
        if (hints.isEmpty()) {
            return "";
        }
        return "Fixes that resolved these errors before:\n"
            + hints.stream().map(FixHint::render).collect(Collectors.joining("\n"));
    }

    private static Map<String, Object> wireError(ExternalError error) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("node_num", error.nodeId());
        wire.put("field_name", error.field());
        wire.put("error_description", error.message());
        wire.put("field_entry", error.fieldEntry());
        return wire;
    }

    private static List<String> strings(JsonNode array) {
        var out = new ArrayList<String>();
        array.forEach(item -> out.add(item.asText()));
        return out;
    }
}
