package com.qubi.hookhub.core.model;

public record Source(
        String name,          // id del collector, ej. "clj-tomcat"
        String encoding,      // "UTF-8"
        String hostname       // opcional: host reportado por el collector
) {}
