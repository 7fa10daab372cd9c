package com.pbpreminder.bot.notify;

public record ChoiceButton(String label, String data) {
}
