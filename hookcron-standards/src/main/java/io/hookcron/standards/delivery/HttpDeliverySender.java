package io.hookcron.standards.delivery;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.inject.Inject;
import io.hookcron.client.config.Config;
import io.hookcron.spi.DeliveryAttachment;
import io.hookcron.spi.DeliveryRequest;
import io.hookcron.spi.DeliveryResult;
import io.hookcron.spi.DeliverySender;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.client.api.ContentProvider;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.BytesContentProvider;
import org.eclipse.jetty.client.util.MultiPartContentProvider;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.util.ssl.SslContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.eclipse.jetty.http.HttpHeader.USER_AGENT;

/**
 * Delivers a message with a single HTTP POST using the Jetty client.
 */
public class HttpDeliverySender
        implements DeliverySender
{
    private static final Logger logger = LoggerFactory.getLogger(HttpDeliverySender.class);

    private final DeliveryConfig config;

    @Inject
    public HttpDeliverySender(Config systemConfig)
    {
        this(DeliveryConfig.convertFrom(systemConfig));
    }

    @VisibleForTesting
    HttpDeliverySender(DeliveryConfig config)
    {
        this.config = config;
    }

    @Override
    public DeliveryResult send(DeliveryRequest request)
    {
        URI uri;
        try {
            uri = targetUri(request.getUrl());
        }
        catch (URISyntaxException | IllegalArgumentException ex) {
            // validated at creation time. a row edited by hand can still get here.
            logger.warn("Invalid webhook URL: {}", ex.getMessage());
            return DeliveryResult.rejected(0, "Invalid webhook URL: " + ex.getMessage());
        }

        HttpClient httpClient;
        try {
            httpClient = client();
        }
        catch (RuntimeException ex) {
            logger.warn("Failed to start http client", ex);
            return DeliveryResult.transientFailure(Optional.absent(), ex.getMessage());
        }
        try {
            return execute(httpClient, uri, request);
        }
        catch (RuntimeException ex) {
            // Jetty rejects some requests synchronously instead of failing the response
            logger.warn("Webhook request failed: POST {}: {}", safeUri(uri), ex.toString());
            return DeliveryResult.transientFailure(Optional.absent(), ex.toString());
        }
        finally {
            stop(httpClient);
        }
    }

    private DeliveryResult execute(HttpClient httpClient, URI uri, DeliveryRequest request)
    {
        Request req = httpClient.newRequest(uri)
            .method(HttpMethod.POST)
            .timeout(config.getTimeout(), SECONDS)
            .content(content(request));

        String safeUri = safeUri(uri);
        logger.debug("Sending webhook: POST {} ({} attachments)", safeUri, request.getAttachments().size());

        ContentResponse res;
        try {
            res = req.send();
        }
        catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.warn("Webhook request interrupted: POST {}", safeUri);
            return DeliveryResult.transientFailure(Optional.absent(), "Interrupted");
        }
        catch (TimeoutException ex) {
            logger.warn("Webhook request timed out after {} seconds: POST {}", config.getTimeout(), safeUri);
            return DeliveryResult.transientFailure(Optional.absent(), "Timed out after " + config.getTimeout() + " seconds");
        }
        catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            logger.warn("Webhook request failed: POST {}: {}", safeUri, cause.toString());
            return DeliveryResult.transientFailure(Optional.absent(), cause.toString());
        }

        int status = res.getStatus();
        if (HttpStatus.isSuccess(status)) {
            logger.debug("Webhook delivered: POST {}: {}", safeUri, status);
            return DeliveryResult.success(status);
        }

        String message = status + " " + HttpStatus.getMessage(status) + responseSummary(res);
        if (HttpStatus.isClientError(status)) {
            // 4xx: the target refused this message
            logger.warn("Webhook rejected: POST {}: {}", safeUri, message);
            return DeliveryResult.rejected(status, message);
        }
        else {
            // 5xx or unexpected status. Hopefully ephemeral.
            logger.warn("Webhook delivery failed: POST {}: {}", safeUri, message);
            return DeliveryResult.transientFailure(Optional.of(status), message);
        }
    }

    private ContentProvider content(DeliveryRequest request)
    {
        List<DeliveryAttachment> attachments = request.getAttachments();
        if (attachments.isEmpty()) {
            return new StringContentProvider("application/json", request.getPayloadJson(), UTF_8);
        }

        MultiPartContentProvider multiPart = new MultiPartContentProvider();
        multiPart.addFieldPart("payload_json",
                new StringContentProvider("application/json", request.getPayloadJson(), UTF_8), null);
        for (int i = 0; i < attachments.size(); i++) {
            DeliveryAttachment attachment = attachments.get(i);
            multiPart.addFilePart("files[" + i + "]", attachment.getFileName(),
                    new BytesContentProvider(attachment.getContentType(), attachment.getContent()), null);
        }
        multiPart.close();
        return multiPart;
    }

    private String responseSummary(ContentResponse res)
    {
        String body = res.getContentAsString();
        if (body == null || body.isEmpty()) {
            return "";
        }
        if (body.length() > config.getMaxErrorMessageSize()) {
            body = body.substring(0, config.getMaxErrorMessageSize()) + "...";
        }
        return ": " + body;
    }

    @VisibleForTesting
    URI targetUri(String url)
            throws URISyntaxException
    {
        URI uri = new URI(url);
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new URISyntaxException(url, "Absolute URL is required");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ENGLISH);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new URISyntaxException(url, "Unsupported scheme " + uri.getScheme());
        }
        if (!config.getWaitForResult()) {
            return uri;
        }
        String query = uri.getRawQuery();
        if (query != null && query.matches("(^|.*&)wait=.*")) {
            return uri;
        }
        String newQuery = (query == null || query.isEmpty()) ? "wait=true" : query + "&wait=true";
        return new URI(uri.getScheme() + "://" + uri.getRawAuthority() + (uri.getRawPath() == null ? "" : uri.getRawPath()) + "?" + newQuery);
    }

    // webhook URLs contain a token in the path
    private static String safeUri(URI uri)
    {
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        int lastSlash = path.lastIndexOf('/');
        if (lastSlash > 0) {
            path = path.substring(0, lastSlash + 1) + "***";
        }
        return uri.getScheme() + "://" + uri.getRawAuthority() + path;
    }

    HttpClient client()
    {
        HttpClient httpClient = new HttpClient(new SslContextFactory.Client());
        httpClient.setFollowRedirects(false);
        httpClient.setUserAgentField(new HttpField(USER_AGENT, config.getUserAgent()));
        try {
            httpClient.start();
        }
        catch (Exception e) {
            throw new RuntimeException("Failed to start http client", e);
        }
        return httpClient;
    }

    void stop(HttpClient httpClient)
    {
        try {
            httpClient.stop();
        }
        catch (Exception e) {
            logger.warn("Failed to stop http client", e);
        }
    }
}
