package org.pragmatica.authz.model;

/**
 * @param expressionText canonical infix form, operators surrounded by single spaces
 */
public record Permission(String name, String expressionText) {}
