package sentinel.support;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;

import sentinel.core.model.PreparedProxyRequest;
import sentinel.core.model.ProxyResponse;
import sentinel.core.port.out.ProxyClient;

/**
 * Records prepared requests and answers with a configurable response.
 */
public class FakeProxyClient implements ProxyClient {

    private final List<PreparedProxyRequest> requests = new ArrayList<>();
    private Function<PreparedProxyRequest, Uni<ProxyResponse>> responder =
            request -> Uni.createFrom().item(json(200, "{\"ok\":true}"));

    public FakeProxyClient respondWith(ProxyResponse response) {
        this.responder = request -> Uni.createFrom().item(response);
        return this;
    }

    public FakeProxyClient failWith(Throwable error) {
        this.responder = request -> Uni.createFrom().failure(error);
        return this;
    }

    @Override
    public Uni<ProxyResponse> forward(PreparedProxyRequest request) {
        requests.add(request);
        return responder.apply(request);
    }

    public List<PreparedProxyRequest> requests() {
        return requests;
    }

    public PreparedProxyRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public static ProxyResponse json(int status, String body) {
        return new ProxyResponse(
                status, Map.of("Content-Type", List.of("application/json")), body.getBytes(StandardCharsets.UTF_8));
    }
}
