package com.emcit.api.admin;

import com.emcit.api.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AdminUserIntegrationTest extends IntegrationTestSupport {

  private Map<String, String> newUser(String email, String role) {
    return Map.of("fullName", "Jane Doe", "email", email, "password", "long-enough-pw", "role", role);
  }

  private String createUser(String token, String email, String role) throws Exception {
    MvcResult r = mvc.perform(post("/api/v1/admin/users")
            .header("Authorization", token)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(newUser(email, role))))
        .andExpect(status().isCreated())
        .andReturn();
    return read(r).get("id").asText();
  }

  private static String email() {
    return "u-" + UUID.randomUUID() + "@emcit.test";
  }

  @Test
  void createdUserCanLogInAndHashIsNeverListed() throws Exception {
    String root = rootToken();
    String email = email();
    createUser(root, email, "admin");

    MvcResult r = mvc.perform(get("/api/v1/admin/users").header("Authorization", root))
        .andExpect(status().isOk())
        .andReturn();
    assertThat(r.getResponse().getContentAsString()).contains(email).doesNotContain("passwordHash").doesNotContain("$2a$");

    assertThat(login(email, "long-enough-pw")).startsWith("Bearer ");
  }

  @Test
  void duplicateEmailIsRejectedIgnoringCase() throws Exception {
    String root = rootToken();
    String email = email();
    createUser(root, email, "user");

    mvc.perform(post("/api/v1/admin/users")
            .header("Authorization", root)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(newUser(email.toUpperCase(), "user"))))
        .andExpect(status().isBadRequest());
  }

  @Test
  void adminCannotCreateSuperAdmin() throws Exception {
    String admin = tokenForNewUser("admin");

    mvc.perform(post("/api/v1/admin/users")
            .header("Authorization", admin)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(newUser(email(), "super_admin"))))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("Unauthorized"));
  }

  @Test
  void unknownRoleIsBadRequest() throws Exception {
    mvc.perform(post("/api/v1/admin/users")
            .header("Authorization", rootToken())
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(newUser(email(), "janitor"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("bad_request"));
  }

  @Test
  void shortPasswordReportsTheField() throws Exception {
    mvc.perform(post("/api/v1/admin/users")
            .header("Authorization", rootToken())
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("fullName", "Jane Doe", "email", email(), "password", "short", "role", "user"))))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation_error"))
        .andExpect(jsonPath("$.fields.password").exists());
  }

  @Test
  void malformedJsonIsBadRequest() throws Exception {
    mvc.perform(post("/api/v1/admin/users")
            .header("Authorization", rootToken())
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("malformed_body"));
  }

  @Test
  void updateChangesProfileAndRole() throws Exception {
    String root = rootToken();
    String id = createUser(root, email(), "user");

    mvc.perform(put("/api/v1/admin/users/{id}", id)
            .header("Authorization", root)
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("role", "admin", "designation", "Network Engineer", "department", "IT"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").value("admin"))
        .andExpect(jsonPath("$.designation").value("Network Engineer"))
        .andExpect(jsonPath("$.department").value("IT"));
  }

  @Test
  void onlySuperAdminDeletes() throws Exception {
    String root = rootToken();
    String admin = tokenForNewUser("admin");
    String id = createUser(root, email(), "user");

    mvc.perform(delete("/api/v1/admin/users/{id}", id).header("Authorization", admin))
        .andExpect(status().isForbidden());
    mvc.perform(delete("/api/v1/admin/users/{id}", id).header("Authorization", root))
        .andExpect(status().isNoContent());
    mvc.perform(delete("/api/v1/admin/users/{id}", id).header("Authorization", root))
        .andExpect(status().isNotFound());
  }

  @Test
  void plainUserIsKeptOutOfAdminRoutes() throws Exception {
    String user = tokenForNewUser("user");

    mvc.perform(get("/api/v1/admin/users").header("Authorization", user))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("Unauthorized"));
  }

  @Test
  void loginTellsAdminsAndStaffWhereToLand() throws Exception {
    mvc.perform(post("/api/v1/auth/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("email", ROOT_EMAIL, "password", ROOT_PASSWORD))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").value("super_admin"))
        .andExpect(jsonPath("$.landing").value("admin-dashboard"));

    String email = email();
    createUser(rootToken(), email, "user");
    mvc.perform(post("/api/v1/auth/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("email", email, "password", "long-enough-pw"))))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").value("user"))
        .andExpect(jsonPath("$.landing").value("portal"));
  }

  @Test
  void wrongPasswordIsRejected() throws Exception {
    mvc.perform(post("/api/v1/auth/login")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body(Map.of("email", ROOT_EMAIL, "password", "not-it"))))
        .andExpect(status().isBadRequest());
  }

  @Test
  void meReflectsTokenClaims() throws Exception {
    mvc.perform(get("/api/v1/me").header("Authorization", rootToken()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.email").value(ROOT_EMAIL))
        .andExpect(jsonPath("$.role").value("super_admin"));
  }
}
