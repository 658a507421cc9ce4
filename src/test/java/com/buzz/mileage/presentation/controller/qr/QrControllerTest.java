package com.buzz.mileage.presentation.controller.qr;

import com.buzz.mileage.application.qr.dto.QrTokenResponse;
import com.buzz.mileage.application.qr.dto.RedeemCouponQrRequest;
import com.buzz.mileage.application.qr.dto.RedeemCouponQrResponse;
import com.buzz.mileage.application.qr.dto.RedeemMileageQrRequest;
import com.buzz.mileage.application.qr.dto.VerifyQrResponse;
import com.buzz.mileage.application.qr.usecase.IssueCouponQrUseCase;
import com.buzz.mileage.application.qr.usecase.IssueMileageQrUseCase;
import com.buzz.mileage.application.qr.usecase.RedeemCouponQrUseCase;
import com.buzz.mileage.application.qr.usecase.RedeemMileageQrUseCase;
import com.buzz.mileage.application.qr.usecase.VerifyQrUseCase;
import com.buzz.mileage.domain.ledger.exception.InsufficientBalanceException;
import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.exception.TokenAlreadyConsumedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * QR 컨트롤러 테스트
 */
@WebMvcTest(QrController.class)
@ActiveProfiles("test")
@DisplayName("QR 컨트롤러 테스트")
class QrControllerTest {

    private static final String PAYLOAD = "BUZZ:MILEAGE:eyJhbGciOiJIUzI1NiJ9.e30.sig";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IssueMileageQrUseCase issueMileageQrUseCase;

    @MockBean
    private IssueCouponQrUseCase issueCouponQrUseCase;

    @MockBean
    private VerifyQrUseCase verifyQrUseCase;

    @MockBean
    private RedeemMileageQrUseCase redeemMileageQrUseCase;

    @MockBean
    private RedeemCouponQrUseCase redeemCouponQrUseCase;

    @Test
    @DisplayName("POST /api/qr/mileage - 마일리지 QR 을 발급한다")
    void 마일리지_QR_발급_성공() throws Exception {
        // given
        LocalDateTime expiresAt = LocalDateTime.of(2025, 3, 1, 12, 10);
        given(issueMileageQrUseCase.execute("A-001"))
                .willReturn(new QrTokenResponse("T-001", TokenKind.MILEAGE, null, PAYLOAD, expiresAt, 600L));

        // when & then
        mockMvc.perform(post("/api/qr/mileage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\"A-001\"}"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokenId").value("T-001"))
                .andExpect(jsonPath("$.kind").value("MILEAGE"))
                .andExpect(jsonPath("$.payload").value(PAYLOAD))
                .andExpect(jsonPath("$.expiresInSeconds").value(600));
    }

    @Test
    @DisplayName("POST /api/qr/mileage - 계정 ID 가 없으면 400")
    void 마일리지_QR_발급_검증_실패() throws Exception {
        // when & then
        mockMvc.perform(post("/api/qr/mileage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"accountId\":\" \"}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"))
                .andExpect(jsonPath("$.message").value("계정 ID는 필수입니다"));

        verify(issueMileageQrUseCase, never()).execute(any());
    }

    @Test
    @DisplayName("POST /api/qr/verify - 만료된 QR 은 200 과 함께 사유 코드를 돌려준다")
    void QR_검증_만료() throws Exception {
        // given
        given(verifyQrUseCase.execute(PAYLOAD)).willReturn(new VerifyQrResponse(
                false, "expired", "T-001", "MILEAGE", LocalDateTime.of(2025, 3, 1, 12, 10),
                null, null, null, null));

        // when & then
        mockMvc.perform(post("/api/qr/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"" + PAYLOAD + "\"}"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.reason").value("expired"))
                .andExpect(jsonPath("$.accountName").value(nullValue()));
    }

    @Test
    @DisplayName("POST /api/qr/redeem/mileage - 경합에서 진 요청은 409 Q004")
    void 마일리지_QR_사용_경합_패배() throws Exception {
        // given
        given(redeemMileageQrUseCase.execute(any(RedeemMileageQrRequest.class)))
                .willThrow(new TokenAlreadyConsumedException("T-001"));

        // when & then
        mockMvc.perform(post("/api/qr/redeem/mileage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"" + PAYLOAD + "\",\"merchantId\":\"M-001\",\"amount\":3000}"))
                .andDo(print())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("Q004"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("POST /api/qr/redeem/mileage - 잔액 부족은 400 M001")
    void 마일리지_QR_사용_잔액_부족() throws Exception {
        // given
        given(redeemMileageQrUseCase.execute(any(RedeemMileageQrRequest.class)))
                .willThrow(new InsufficientBalanceException(3000L, 1000L));

        // when & then
        mockMvc.perform(post("/api/qr/redeem/mileage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"" + PAYLOAD + "\",\"merchantId\":\"M-001\",\"amount\":3000}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("M001"));
    }

    @Test
    @DisplayName("POST /api/qr/redeem/mileage - 사용 금액이 0 이면 400")
    void 마일리지_QR_사용_금액_검증() throws Exception {
        // when & then
        mockMvc.perform(post("/api/qr/redeem/mileage")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"" + PAYLOAD + "\",\"merchantId\":\"M-001\",\"amount\":0}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"));

        verify(redeemMileageQrUseCase, never()).execute(any());
    }

    @Test
    @DisplayName("POST /api/qr/redeem/coupon - 이벤트 쿠폰은 지원금이 분리된 정산 결과를 돌려준다")
    void 쿠폰_QR_사용_성공() throws Exception {
        // given
        given(redeemCouponQrUseCase.execute(any(RedeemCouponQrRequest.class)))
                .willReturn(new RedeemCouponQrResponse("T-002", "S-001", "C-001", "EVENT_COUPON",
                        10_000L, 5_000L, 5_000L, LocalDateTime.of(2025, 3, 1, 12, 0)));

        // when & then
        mockMvc.perform(post("/api/qr/redeem/coupon")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payload\":\"BUZZ:COUPON:abc\",\"merchantId\":\"M-001\",\"orderAmount\":20000}"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.settlementKind").value("EVENT_COUPON"))
                .andExpect(jsonPath("$.subsidyAmount").value(5000))
                .andExpect(jsonPath("$.netAmount").value(5000));
    }
}
