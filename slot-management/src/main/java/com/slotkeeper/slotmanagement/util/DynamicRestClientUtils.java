package com.slotkeeper.slotmanagement.util;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.rest.client.RestClientBuilder;

import java.io.Closeable;
import java.net.URI;
import java.util.concurrent.TimeUnit;

@Slf4j
@ApplicationScoped
public class DynamicRestClientUtils {

    public <T> T createRestClient(Class<T> clazz, String address, int port, long timeoutMs) {
        URI uri = URI.create("http://" + address + ":" + port);

        return RestClientBuilder.newBuilder()
                .baseUri(uri)
                .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .build(clazz);
    }

    public void closeClient(Closeable client) {
        if (client == null) {
            return;
        }

        try {
            client.close();
        } catch (Exception e) {
            log.debug("Failed to close REST client", e);
        }
    }
}
