package com.dataforge.scoring;

import java.io.IOException;

public class RateLimitedException extends IOException {
    public RateLimitedException(String message) {
        super(message);
    }
}
