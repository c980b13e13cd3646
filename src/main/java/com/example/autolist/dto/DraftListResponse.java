package com.example.autolist.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftListResponse {

    private List<DraftResponse> drafts;
    private long total;
    private int page;
    private int pageSize;
}
