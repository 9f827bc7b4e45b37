package com.goormthonuniv.newscheckr.summarize;

public record Summary(String text, String method) {

    public static final String VERBATIM = "verbatim";
}
