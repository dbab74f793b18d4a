package com.deepansh.assistant.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MemoryRequest {

    /** user_preference | user_info | topic_interest | interaction | fact */
    @NotBlank(message = "type must not be blank")
    private String type;

    @NotBlank(message = "content must not be blank")
    private String content;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double importance;
}
