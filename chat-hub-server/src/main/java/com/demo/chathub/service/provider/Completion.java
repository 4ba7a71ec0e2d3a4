package com.demo.chathub.service.provider;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class Completion {
    String model;
    String content;
}
