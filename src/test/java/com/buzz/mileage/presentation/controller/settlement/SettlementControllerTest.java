package com.buzz.mileage.presentation.controller.settlement;

import com.buzz.mileage.application.settlement.dto.SettlementResponse;
import com.buzz.mileage.application.settlement.usecase.ApproveSettlementUseCase;
import com.buzz.mileage.application.settlement.usecase.GetMerchantSettlementsUseCase;
import com.buzz.mileage.application.settlement.usecase.PaySettlementUseCase;
import com.buzz.mileage.application.settlement.usecase.RejectSettlementUseCase;
import com.buzz.mileage.domain.settlement.entity.SettlementStatus;
import com.buzz.mileage.domain.settlement.exception.InvalidSettlementTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 정산 컨트롤러 테스트
 */
@WebMvcTest(SettlementController.class)
@ActiveProfiles("test")
@DisplayName("정산 컨트롤러 테스트")
class SettlementControllerTest {

    private static final LocalDateTime REQUESTED_AT = LocalDateTime.of(2025, 3, 1, 12, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetMerchantSettlementsUseCase getMerchantSettlementsUseCase;

    @MockBean
    private ApproveSettlementUseCase approveSettlementUseCase;

    @MockBean
    private RejectSettlementUseCase rejectSettlementUseCase;

    @MockBean
    private PaySettlementUseCase paySettlementUseCase;

    @Test
    @DisplayName("GET /api/settlements - 가맹점의 정산 목록을 상태로 걸러 조회한다")
    void 정산_목록_조회() throws Exception {
        // given
        given(getMerchantSettlementsUseCase.execute("M-001", SettlementStatus.REQUESTED))
                .willReturn(List.of(settlement("S-001", "REQUESTED", null), settlement("S-002", "REQUESTED", null)));

        // when & then
        mockMvc.perform(get("/api/settlements")
                        .param("merchantId", "M-001")
                        .param("status", "REQUESTED"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].subsidyAmount").value(5000))
                .andExpect(jsonPath("$[0].netAmount").value(5000));
    }

    @Test
    @DisplayName("POST /api/settlements/{id}/approve - 승인된 정산을 돌려준다")
    void 정산_승인() throws Exception {
        // given
        given(approveSettlementUseCase.execute("S-001", "ADMIN-1")).willReturn(settlement("S-001", "APPROVED", "ADMIN-1"));

        // when & then
        mockMvc.perform(post("/api/settlements/S-001/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"approverId\":\"ADMIN-1\"}"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.approvedBy").value("ADMIN-1"));
    }

    @Test
    @DisplayName("POST /api/settlements/{id}/pay - 승인 전 지급은 400 S002")
    void 승인_전_지급() throws Exception {
        // given
        given(paySettlementUseCase.execute("S-001")).willThrow(
                new InvalidSettlementTransitionException("S-001", SettlementStatus.REQUESTED, SettlementStatus.PAID));

        // when & then
        mockMvc.perform(post("/api/settlements/S-001/pay"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("S002"));
    }

    @Test
    @DisplayName("POST /api/settlements/{id}/reject - 반려 사유가 없으면 400")
    void 반려_사유_누락() throws Exception {
        // when & then
        mockMvc.perform(post("/api/settlements/S-001/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"\"}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"))
                .andExpect(jsonPath("$.message").value("반려 사유는 필수입니다"));

        verify(rejectSettlementUseCase, never()).execute(anyString(), any());
    }

    private static SettlementResponse settlement(String id, String status, String approvedBy) {
        return new SettlementResponse(id, "M-001", "EVENT_COUPON", 10_000L, 5_000L, 5_000L, status,
                "T-" + id, "C-" + id, REQUESTED_AT,
                approvedBy == null ? null : REQUESTED_AT.plusHours(1), approvedBy, null, null, null);
    }
}
