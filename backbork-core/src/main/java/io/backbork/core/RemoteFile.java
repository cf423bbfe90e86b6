package io.backbork.core;

import java.time.Instant;

public record RemoteFile(String name, long size, Instant modifiedTime) {
}
