package dev.flowdoctor.backend;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

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

class HttpSemanticValidatorTest {

    private static final String URL = "http://validator.test/validate";

    private final RestTemplate restTemplate = mock(RestTemplate.class);
    private final HttpSemanticValidator validator = new HttpSemanticValidator(restTemplate, URL);
    private final Credentials credentials = new Credentials("bot-7", "secret");

    @Test
    void postsDocumentAndCredentials() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
            .thenReturn(ResponseEntity.ok("{\"valid\": true, \"versionId\": \"v-12\"}"));

        ValidationResponse response = validator.validate("csv-text", credentials);

        assertThat(response.valid()).isTrue();
        assertThat(response.versionId()).isEqualTo("v-12");
        ArgumentCaptor<Object> request = ArgumentCaptor.forClass(Object.class);
        verify(restTemplate).postForEntity(eq(URL), request.capture(), eq(String.class));
        assertThat(request.getValue())
            .asInstanceOf(type(HttpEntity.class))
            .extracting(HttpEntity::getBody, as(map(String.class, Object.class)))
            .containsEntry("csv", "csv-text")
            .containsEntry("botId", "bot-7")
            .containsEntry("token", "secret");
    }

    @Test
    void unauthorizedIsAnAuthenticationFailure() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
            .thenThrow(HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized",
                HttpHeaders.EMPTY, new byte[0], null));

        assertThatThrownBy(() -> validator.validate("csv", credentials))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("semantic validator");
    }

    @Test
    void serverErrorsCarryTheirStatus() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
            .thenThrow(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "Bad Gateway",
                HttpHeaders.EMPTY, new byte[0], null));

        assertThatThrownBy(() -> validator.validate("csv", credentials))
            .isInstanceOfSatisfying(ExternalServiceException.class,
                e -> assertThat(e.status()).contains(502))
            .isNotInstanceOf(AuthenticationException.class);
    }

    @Test
    void unreachableValidatorIsAServiceFailure() {
        when(restTemplate.postForEntity(eq(URL), any(), eq(String.class)))
            .thenThrow(new ResourceAccessException("Connection refused"));

        assertThatThrownBy(() -> validator.validate("csv", credentials))
            .isInstanceOfSatisfying(ExternalServiceException.class,
                e -> assertThat(e.status()).isEmpty())
            .hasMessageContaining("Connection refused");
    }

    @Test
    void authErrorFlagIsAnAuthenticationFailure() {
        assertThatThrownBy(() -> HttpSemanticValidator.parse("{\"authError\": true, \"errors\": \"token expired\"}"))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("token expired");
    }

    @Test
    void parsesNestedErrorMessages() {
        ValidationResponse response = HttpSemanticValidator.parse("""
            {"valid": false, "errors": [
              {"node_num": "105", "err_msgs": [
                {"field_name": "Next Nodes", "error_description": "Node 300 does not exist", "field_entry": "300"},
                {"field_name": "Message", "error_description": "Too long"}
              ]}
            ]}""");

        assertThat(response.valid()).isFalse();
        assertThat(response.errors()).containsExactly(
            new ExternalError(105, "Next Nodes", "Node 300 does not exist", "300"),
            new ExternalError(105, "Message", "Too long", ""));
    }

    @Test
    void parsesFlatErrors() {
        ValidationResponse response = HttpSemanticValidator.parse("""
            {"valid": false, "errors": [{"nodeId": 7, "field": "Variable", "message": "Use capital letters"}]}""");

        assertThat(response.errors()).containsExactly(ExternalError.of(7, "Variable", "Use capital letters"));
    }

    @Test
    void textualErrorsBecomeOneError() {
        ValidationResponse response = HttpSemanticValidator.parse("{\"valid\": false, \"errors\": \"CSV is empty\"}");

        assertThat(response.errors()).containsExactly(ExternalError.of(null, "", "CSV is empty"));
    }

    @Test
    void rejectsUnreadableResponses() {
        assertThatThrownBy(() -> HttpSemanticValidator.parse("<html>"))
            .isInstanceOf(ExternalServiceException.class);
        assertThatThrownBy(() -> HttpSemanticValidator.parse("[1, 2]"))
            .isInstanceOf(ExternalServiceException.class)
            .hasMessageContaining("not a JSON object");
    }
}
