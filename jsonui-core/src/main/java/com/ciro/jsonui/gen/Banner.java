package com.ciro.jsonui.gen;

final class Banner {

    static final String LINE = "// Generated by jsonui - do not edit directly";

    private Banner() {}
}
