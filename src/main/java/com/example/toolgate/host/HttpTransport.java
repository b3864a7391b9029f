package com.example.toolgate.host;

import java.io.IOException;
import java.net.URI;

public interface HttpTransport {

    record Response(int status, String body) {
    }

    Response postJson(URI uri, String body) throws IOException, InterruptedException;
}
