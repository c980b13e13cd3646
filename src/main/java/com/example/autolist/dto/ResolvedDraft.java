package com.example.autolist.dto;

import com.example.autolist.domain.Draft;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 초안 저장 결과
 * 기존 초안에 병합되었으면 merged=true이며, 호출 측은 반드시 draft.getId()를 사용해야 합니다.
 */
@Getter
@AllArgsConstructor
public class ResolvedDraft {

    private final Draft draft;
    private final boolean merged;

    public String getId() {
        return draft.getId();
    }
}
