package tech.yump.boundary.csrf;

public enum RequestClass {
    API,
    SSR
}
