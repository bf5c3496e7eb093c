package com.example.datarecovery;

import com.example.datarecovery.service.RecoveryManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest
class DataRecoveryApplicationTests {

	@Autowired
	private RecoveryManager recoveryManager;

	@Test
	void contextLoads() {
		// Context starts with the test encryption key and an in-memory database
		assertNotNull(recoveryManager);
	}

}
