package com.securepad.portal.identity;

public enum Role { STUDENT, ADMIN }
