package com.example.mediastore_backend.layout;

import java.util.UUID;

/** Anything whose derived files are laid out per owner. */
public interface PathOwner {

    UUID getId();

    UUID getOwnerId();
}
