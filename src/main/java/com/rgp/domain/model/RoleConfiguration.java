package com.rgp.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Admin and operator roles of one guarantee engine.
 * The admin is fixed at construction and is always an operator.
 */
public class RoleConfiguration {
    private final String admin;
    private final Set<String> operators;

    public RoleConfiguration(String admin) {
        this(admin, new LinkedHashSet<>(Set.of(admin)));
    }

    private RoleConfiguration(String admin, Set<String> operators) {
        this.admin = admin;
        this.operators = operators;
    }

    public String getAdmin() {
        return admin;
    }

    public Set<String> getOperators() {
        return Collections.unmodifiableSet(operators);
    }

    public boolean isAdmin(String caller) {
        return admin.equals(caller);
    }

    public boolean isOperator(String caller) {
        return operators.contains(caller);
    }

    public boolean addOperator(String operator) {
        return operators.add(operator);
    }

    public boolean removeOperator(String operator) {
        return operators.remove(operator);
    }

    public RoleConfiguration copy() {
        return new RoleConfiguration(admin, new LinkedHashSet<>(operators));
    }
}
