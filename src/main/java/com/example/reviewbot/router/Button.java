package com.example.reviewbot.router;

public record Button(String label, String token) {
}
