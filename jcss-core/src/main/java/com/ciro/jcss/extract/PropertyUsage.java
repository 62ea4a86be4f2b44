package com.ciro.jcss.extract;

public record PropertyUsage(String property, int count) {}
