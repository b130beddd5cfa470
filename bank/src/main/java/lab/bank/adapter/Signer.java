package lab.bank.adapter;

import org.web3j.crypto.RawTransaction;

// Signs withdrawals paid from the custody wallet.
public interface Signer {

    String signWithdrawal(RawTransaction withdrawal, long chainId);

    String custodyAddress();
}
