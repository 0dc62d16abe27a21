package dev.flowdoctor.backend;

/**
 * Session credentials passed through to the semantic validator.
 */
public record Credentials(String botId, String token) {

    public Credentials {
        botId = botId == null ? "" : botId;
        token = token == null ? "" : token;
    }

    @Override
    public String toString() {
        return "Credentials[botId=" + botId + ", token=***]";
    }
}
