package com.connectpro.policy;

/** Attribution appended to text sent through dedicated bots. */
public class Footer {

    private static final String SEPARATOR = "\n\n—\n";

    private final String text;

    public Footer(String text) {
        this.text = text;
    }

    public String add(String message) {
        return message + SEPARATOR + text;
    }

    public String remove(String message) {
        return message.replace(SEPARATOR + text, "");
    }
}
