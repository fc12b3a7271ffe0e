package sentinel.core.port.out;

import io.smallrye.mutiny.Uni;

import sentinel.core.model.PreparedProxyRequest;
import sentinel.core.model.ProxyResponse;

public interface ProxyClient {

    /**
     * Sends the request upstream. The returned {@code Uni} fails with a
     * {@link java.util.concurrent.TimeoutException} (or an exception caused by one) when
     * {@link PreparedProxyRequest#timeout()} elapses, and the in-flight request is reset.
     */
    Uni<ProxyResponse> forward(PreparedProxyRequest request);
}
