package com.cardiorecords.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeleteAllResponse {
    private long deletedCount;
    private String message;
}
