package com.sparrowwallet.pipit.adb;

/**
 * Sub-types of the AUTH message, carried in arg0.
 */
public enum AuthType {
    TOKEN(1), SIGNATURE(2), RSAPUBLICKEY(3);

    private final int type;

    AuthType(int type) {
        this.type = type;
    }

    public int getType() {
        return type;
    }

    public static AuthType fromType(int type) {
        for(AuthType authType : values()) {
            if(authType.type == type) {
                return authType;
            }
        }

        return null;
    }
}
