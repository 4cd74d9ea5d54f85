package com.example.datalifecycle.access;

import com.example.datalifecycle.models.RefreshToken;

public interface RefreshTokenAccess extends UserLinkedDataAccess<RefreshToken> {
}
