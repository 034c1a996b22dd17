package com.qubi.hookhub.core.model;

public record QueryParam(
        String name,
        String value          // puede venir null ("?flag" sin '=')
) {}
