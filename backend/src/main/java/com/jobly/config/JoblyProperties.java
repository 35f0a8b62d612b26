package com.jobly.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobly")
public class JoblyProperties {
    private Auth auth = new Auth();

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public static class Auth {
        private static final int MIN_WORK_FACTOR = 4;
        private static final int MAX_WORK_FACTOR = 31;

        private String secretKey;
        private int bcryptWorkFactor = 12;

        public String getSecretKey() {
            return secretKey;
        }

        public void setSecretKey(String secretKey) {
            this.secretKey = secretKey == null ? null : secretKey.trim();
        }

        public int getBcryptWorkFactor() {
            return clampWorkFactor(bcryptWorkFactor);
        }

        public void setBcryptWorkFactor(int bcryptWorkFactor) {
            this.bcryptWorkFactor = clampWorkFactor(bcryptWorkFactor);
        }

        private static int clampWorkFactor(int value) {
            return Math.max(MIN_WORK_FACTOR, Math.min(MAX_WORK_FACTOR, value));
        }
    }
}
