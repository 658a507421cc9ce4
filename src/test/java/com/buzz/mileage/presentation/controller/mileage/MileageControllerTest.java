package com.buzz.mileage.presentation.controller.mileage;

import com.buzz.mileage.application.mileage.dto.AdjustMileageRequest;
import com.buzz.mileage.application.mileage.dto.MileageBalanceResponse;
import com.buzz.mileage.application.mileage.usecase.AdjustMileageUseCase;
import com.buzz.mileage.application.mileage.usecase.GetMileageBalanceUseCase;
import com.buzz.mileage.application.mileage.usecase.GetMileageHistoryUseCase;
import com.buzz.mileage.domain.account.exception.AccountNotFoundException;
import com.buzz.mileage.domain.ledger.exception.InsufficientBalanceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultHandlers.print;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MileageController.class)
@ActiveProfiles("test")
@DisplayName("마일리지 컨트롤러 테스트")
class MileageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GetMileageBalanceUseCase getMileageBalanceUseCase;

    @MockBean
    private GetMileageHistoryUseCase getMileageHistoryUseCase;

    @MockBean
    private AdjustMileageUseCase adjustMileageUseCase;

    @Test
    @DisplayName("GET /api/accounts/{accountId}/mileage - 잔액을 조회한다")
    void 잔액_조회() throws Exception {
        // given
        given(getMileageBalanceUseCase.execute("A-001")).willReturn(new MileageBalanceResponse("A-001", 4_500L));

        // when & then
        mockMvc.perform(get("/api/accounts/A-001/mileage"))
                .andDo(print())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(4500));
    }

    @Test
    @DisplayName("GET /api/accounts/{accountId}/mileage - 없는 계정은 404")
    void 없는_계정() throws Exception {
        // given
        given(getMileageBalanceUseCase.execute("A-404")).willThrow(new AccountNotFoundException("A-404"));

        // when & then
        mockMvc.perform(get("/api/accounts/A-404/mileage"))
                .andDo(print())
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /api/accounts/{accountId}/mileage/adjust - 잔액보다 큰 차감 조정은 400 M001")
    void 차감_조정_잔액_부족() throws Exception {
        // given
        given(adjustMileageUseCase.execute(eq("A-001"), any(AdjustMileageRequest.class)))
                .willThrow(new InsufficientBalanceException(5_000L, 1_000L));

        // when & then
        mockMvc.perform(post("/api/accounts/A-001/mileage/adjust")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":-5000,\"description\":\"오지급 회수\",\"adminId\":\"ADMIN-1\"}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("M001"));
    }

    @Test
    @DisplayName("POST /api/accounts/{accountId}/mileage/adjust - 조정 사유가 없으면 400")
    void 조정_사유_누락() throws Exception {
        // when & then
        mockMvc.perform(post("/api/accounts/A-001/mileage/adjust")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":1000,\"adminId\":\"ADMIN-1\"}"))
                .andDo(print())
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("COMMON001"));
    }
}
