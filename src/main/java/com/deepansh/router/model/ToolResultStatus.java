package com.deepansh.router.model;

public enum ToolResultStatus {
    success, error
}
