package com.sysmon.alert.channel;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

final class HttpChannelSupport {

    private HttpChannelSupport() {}

    static void send(HttpClient client, HttpRequest request, String channelName) throws ChannelException {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ChannelException(channelName + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelException(channelName + " delivery interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new ChannelException(channelName + " answered HTTP " + response.statusCode());
        }
    }
}
