package lichess.client.http;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Flow;

/**
 * The one place the transport touches the network. The returned future completes once response headers arrive;
 * the body is consumed later through its publisher.
 */
@FunctionalInterface
public interface HttpSender {

    CompletableFuture<HttpResponse<Flow.Publisher<List<ByteBuffer>>>> send(HttpRequest request);

    static HttpSender of(HttpClient client) {
        return request -> client.sendAsync(request, HttpResponse.BodyHandlers.ofPublisher());
    }
}
