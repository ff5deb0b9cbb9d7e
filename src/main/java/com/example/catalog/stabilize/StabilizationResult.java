package com.example.catalog.stabilize;

import java.time.Duration;

public record StabilizationResult<T>(T collection, int finalSize, boolean plateaued, int rounds, Duration waited) {
}
