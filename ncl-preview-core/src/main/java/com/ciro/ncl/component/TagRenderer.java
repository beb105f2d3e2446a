package com.ciro.ncl.component;

@FunctionalInterface
public interface TagRenderer {
    String render(ComponentAttributes attrs, String body);
}
