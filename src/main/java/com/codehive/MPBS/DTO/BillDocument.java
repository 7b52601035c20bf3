package com.codehive.MPBS.DTO;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class BillDocument {
    private String fileName;
    private byte[] content;
}
