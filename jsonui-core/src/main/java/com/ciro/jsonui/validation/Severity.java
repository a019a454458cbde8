package com.ciro.jsonui.validation;

public enum Severity {
    INFO,
    WARNING
}
