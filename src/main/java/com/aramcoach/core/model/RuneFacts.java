package com.aramcoach.core.model;

import java.io.Serializable;

public record RuneFacts(
    String id,
    String name,
    String tree
) implements Serializable {}
