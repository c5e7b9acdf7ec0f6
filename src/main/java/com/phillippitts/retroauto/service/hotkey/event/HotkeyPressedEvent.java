package com.phillippitts.retroauto.service.hotkey.event;

import com.phillippitts.retroauto.service.hotkey.HotkeyAction;

import java.time.Instant;

public record HotkeyPressedEvent(HotkeyAction action, Instant at) {}
