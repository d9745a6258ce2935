package io.resumable.http;

import io.resumable.core.WorkItem;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * POSTs one line as the request body. The offset travels in an {@code Idempotency-Key} header because a
 * line may be sent again after a crash between the call and the next checkpoint.
 */
public class HttpPostWorkItem implements WorkItem<String> {
    private final HttpClient client;
    private final URI uri;
    private final String jobId;
    private final Duration timeout;

    public HttpPostWorkItem(URI uri, String jobId, Duration timeout) {
        this.client = HttpClient.newBuilder().connectTimeout(timeout == null ? Duration.ofSeconds(5) : timeout).build();
        this.uri = uri;
        this.jobId = jobId;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    }

    @Override
    public void process(long offset, String line) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "text/plain; charset=utf-8")
                .header("Idempotency-Key", jobId + "-" + offset)
                .POST(HttpRequest.BodyPublishers.ofString(line, StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            throw new HttpStatusException(status, "POST " + uri + " for line " + offset + " returned " + status + ": " + abbreviate(resp.body()));
        }
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 120 ? body : body.substring(0, 117) + "...";
    }
}
