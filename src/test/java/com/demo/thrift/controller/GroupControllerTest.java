package com.demo.thrift.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "thrift.faucet.enabled=true",
        "thrift.admins=0x0000000000000000000000000000000000009009",
        "thrift.insurance.processors=0x0000000000000000000000000000000000008001,0x0000000000000000000000000000000000008002"
})
@AutoConfigureMockMvc
class GroupControllerTest {

    private static final String CALLER = GroupController.CALLER;
    private static final String CREATOR = "0x0000000000000000000000000000000000001000";
    private static final String ALICE = "0x0000000000000000000000000000000000001111";
    private static final String BOB = "0x0000000000000000000000000000000000002222";
    private static final String CAROL = "0x0000000000000000000000000000000000003333";
    private static final String DAVE = "0x0000000000000000000000000000000000004444";

    private static final String ROTATIONAL = """
            {"model":"ROTATIONAL","contributionAmount":100,"cycleInterval":"P7D",
             "gracePeriod":"P1D","groupSize":3}
            """;

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long createGroup(String body) throws Exception {
        MvcResult result = mvc.perform(post("/api/groups").header(CALLER, CREATOR)
                        .contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("CREATED"))
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return json.get("id").asLong();
    }

    private void mint(String address, long amount) throws Exception {
        mvc.perform(post("/api/wallets/{address}/mint", address)
                        .contentType(MediaType.APPLICATION_JSON).content("{\"amount\":" + amount + "}"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("A rotational group runs its first cycle over HTTP")
    void rotationalCycle() throws Exception {
        for (String m : new String[]{ALICE, BOB, CAROL}) {
            mint(m, 1_000);
        }
        long id = createGroup(ROTATIONAL);

        mvc.perform(post("/api/groups/{id}/join", id).header(CALLER, ALICE)).andExpect(status().isOk());
        mvc.perform(post("/api/groups/{id}/join", id).header(CALLER, BOB)).andExpect(status().isOk());
        mvc.perform(post("/api/groups/{id}/join", id).header(CALLER, CAROL))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.currentCycle").value(1));

        mvc.perform(post("/api/groups/{id}/contribute", id).header(CALLER, ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAID"))
                .andExpect(jsonPath("$.amount").value(100));
        mvc.perform(post("/api/groups/{id}/contribute", id).header(CALLER, ALICE))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("PRECONDITION_FAILED"));
        mvc.perform(post("/api/groups/{id}/contribute", id).header(CALLER, BOB)).andExpect(status().isOk());
        mvc.perform(post("/api/groups/{id}/contribute", id).header(CALLER, CAROL)).andExpect(status().isOk());

        mvc.perform(get("/api/groups/{id}/payouts", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].recipient").value(ALICE))
                .andExpect(jsonPath("$[0].amount").value(300));
        mvc.perform(post("/api/groups/{id}/claim-payout", id).header(CALLER, ALICE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(300));
        mvc.perform(get("/api/wallets/{address}", ALICE))
                .andExpect(jsonPath("$.balance").value(1_200));
        mvc.perform(get("/api/groups/{id}/reconciliation", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.principal").value(0));

        mvc.perform(post("/api/groups/{id}/join", id).header(CALLER, DAVE))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Domain errors map to HTTP statuses with a kind")
    void errorMapping() throws Exception {
        mvc.perform(get("/api/groups/{id}", 987_654))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.kind").value("NOT_FOUND"));

        mvc.perform(post("/api/groups").header(CALLER, CREATOR).contentType(MediaType.APPLICATION_JSON)
                        .content(ROTATIONAL.replace("\"groupSize\":3", "\"groupSize\":2")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_INPUT"));

        mvc.perform(post("/api/groups").header(CALLER, "not-an-address").contentType(MediaType.APPLICATION_JSON)
                        .content(ROTATIONAL))
                .andExpect(status().isBadRequest());

        long id = createGroup(ROTATIONAL.replace("\"groupSize\":3", "\"groupSize\":3,\"stakeRequired\":50"));
        mvc.perform(post("/api/groups/{id}/join", id))
                .andExpect(status().isBadRequest());
        mvc.perform(post("/api/groups/{id}/join", id).header(CALLER, DAVE))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("INSUFFICIENT_BALANCE"));
        mvc.perform(post("/api/groups/{id}/cancel", id).header(CALLER, ALICE))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.kind").value("UNAUTHORIZED"));
        mvc.perform(get("/api/groups").param("creator", CREATOR).param("model", "ROTATIONAL"))
                .andExpect(status().isBadRequest());
    }
}
