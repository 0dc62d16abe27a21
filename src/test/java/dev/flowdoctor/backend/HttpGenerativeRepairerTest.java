package dev.flowdoctor.backend;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.as;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.InstanceOfAssertFactories.map;
import static org.assertj.core.api.InstanceOfAssertFactories.type;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpGenerativeRepairerTest {

    private static final String URL = "http://repairer.test/refine";

    private final RestTemplate restTemplate = mock(RestTemplate.class);
    private final HttpGenerativeRepairer repairer = new HttpGenerativeRepairer(restTemplate, URL);

    @Test
    void sendsErrorsIterationAndHints() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
            .thenReturn(ResponseEntity.ok("""
                {"csv": "fixed", "fixesMade": ["shortened node 5"], "stillBroken": []}"""));
        var error = new ExternalError(5, "Message", "Too long", "Hello");
        var hint = new FixHint("message:too long", "MESSAGE_ERROR", "shortened message", 0.75);

        RepairProposal proposal = repairer.propose("broken", List.of(error), 2, List.of(hint));

        assertThat(proposal.csv()).isEqualTo("fixed");
        assertThat(proposal.fixesMade()).containsExactly("shortened node 5");
        ArgumentCaptor<Object> request = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForEntity(eq(URL), request.capture(), eq(String.class));
        assertThat(request.getValue())
            .asInstanceOf(type(HttpEntity.class))
            .extracting(HttpEntity::getBody, as(map(String.class, Object.class)))
            .containsEntry("csv", "broken")
            .containsEntry("iteration", 2)
            .containsEntry("validationErrors", List.of(Map.of(
                "node_num", 5,
                "field_name", "Message",
                "error_description", "Too long",
                "field_entry", "Hello")))
            .extractingByKey("knownFixesContext")
            .isEqualTo("Fixes that resolved these errors before:\n- [MESSAGE_ERROR] shortened message (confidence 75%)");
    }

    @Test
    void unauthorizedIsAnAuthenticationFailure() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
            .thenThrow(HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized",
                HttpHeaders.EMPTY, new byte[0], null));

        assertThatThrownBy(() -> repairer.propose("csv", List.of(), 1, List.of()))
            .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void responseWithoutCsvIsAServiceFailure() {
        assertThatThrownBy(() -> HttpGenerativeRepairer.parse("{\"fixesMade\": []}"))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessageContaining("no csv");
        assertThatThrownBy(() -> HttpGenerativeRepairer.parse("{\"csv\": \"  \"}"))
            .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    void missingListsAreEmpty() {
        RepairProposal proposal = HttpGenerativeRepairer.parse("{\"csv\": \"a,b\"}");

        assertThat(proposal.fixesMade()).isEmpty();
        assertThat(proposal.stillBroken()).isEmpty();
    }

    @Test
    void noHintsMeansEmptyContext() {
        assertThat(HttpGenerativeRepairer.knownFixesContext(List.of())).isEmpty();
    }
}
