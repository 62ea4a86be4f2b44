package com.ciro.jcss.extract;

public record FontDeclaration(String property, String value) {}
