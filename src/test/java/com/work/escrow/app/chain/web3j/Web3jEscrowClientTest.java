package com.work.escrow.app.chain.web3j;

import com.work.escrow.core.exception.AmountOutOfRangeException;
import com.work.escrow.core.model.EscrowAccountView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.tx.gas.StaticGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class Web3jEscrowClientTest {

    private static final String CONTRACT = "0x00000000000000000000000000000000000000c0";
    private static final String RECRUITER = "0x00000000000000000000000000000000000000a1";
    private static final String FREELANCER = "0x00000000000000000000000000000000000000b2";
    private static final BigInteger ONE_ETH = BigInteger.TEN.pow(18);

    private final Web3jService service = mock(Web3jService.class);
    private final Web3j web3j = Web3j.build(service);

    @AfterEach
    public void shutdown() {
        web3j.shutdown();
    }

    private Web3jEscrowClient client(int amountScale) {
        return new Web3jEscrowClient(web3j, CONTRACT, new StaticGasProvider(BigInteger.ONE, BigInteger.ONE),
                10L, 1, amountScale);
    }

    private void chainReturns(String recruiter, BigInteger balance, BigInteger[] amounts, Boolean[] approved)
            throws Exception {
        String encoded = FunctionEncoder.encodeConstructor(Arrays.asList(
                new Address(recruiter),
                new Address(FREELANCER),
                new Uint256(balance),
                new DynamicArray<>(Uint256.class, Arrays.asList(
                        Arrays.stream(amounts).map(Uint256::new).toArray(Uint256[]::new))),
                new DynamicArray<>(Bool.class, Arrays.asList(
                        Arrays.stream(approved).map(a -> new Bool(a.booleanValue())).toArray(Bool[]::new))),
                new DynamicArray<>(Bool.class, Arrays.asList(
                        Arrays.stream(approved).map(a -> new Bool(false)).toArray(Bool[]::new)))));
        EthCall call = new EthCall();
        call.setResult("0x" + encoded);
        when(service.send(any(Request.class), eq(EthCall.class))).thenReturn(call);
    }

    @Test
    public void ten_eth_escrow_decodes_in_gwei_units() throws Exception {
        BigInteger fiveEth = ONE_ETH.multiply(BigInteger.valueOf(5));
        chainReturns(RECRUITER, ONE_ETH.multiply(BigInteger.TEN),
                new BigInteger[]{fiveEth, fiveEth}, new Boolean[]{true, false});

        Optional<EscrowAccountView> read = client(9).readAccount("job1");

        assertTrue(read.isPresent());
        EscrowAccountView view = read.get();
        assertEquals(10_000_000_000L, view.getStakedBalance());
        assertEquals(2, view.stageCount());
        assertEquals(5_000_000_000L, view.stage(0).getAmount());
        assertTrue(view.stage(0).isApproved());
        assertFalse(view.stage(1).isApproved());
        assertEquals(RECRUITER, view.getRecruiterWallet());
        assertEquals(FREELANCER, view.getFreelancerWallet());
        assertEquals(5_000_000_000L, view.claimableAmount());
    }

    @Test
    public void balance_beyond_long_range_is_typed_error() throws Exception {
        BigInteger huge = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
        chainReturns(RECRUITER, huge, new BigInteger[]{huge}, new Boolean[]{false});

        AmountOutOfRangeException e = assertThrows(AmountOutOfRangeException.class,
                () -> client(0).readAccount("job1"));
        assertEquals("job1", e.getJobId());
        assertFalse(e.isRetryable());
    }

    @Test
    public void fractional_unit_is_rejected() throws Exception {
        BigInteger oneWeiOver = ONE_ETH.add(BigInteger.ONE);
        chainReturns(RECRUITER, oneWeiOver, new BigInteger[]{oneWeiOver}, new Boolean[]{false});

        assertThrows(AmountOutOfRangeException.class, () -> client(9).readAccount("job1"));
    }

    @Test
    public void zero_recruiter_means_no_account() throws Exception {
        chainReturns("0x0000000000000000000000000000000000000000", BigInteger.ZERO,
                new BigInteger[0], new Boolean[0]);

        assertFalse(client(9).readAccount("job1").isPresent());
    }
}
